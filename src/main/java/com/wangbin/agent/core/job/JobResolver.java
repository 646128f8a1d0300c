package com.wangbin.agent.core.job;

import com.wangbin.agent.common.exception.ConfigurationException;
import com.wangbin.agent.core.config.GlobalOptions;
import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.plugin.CollectorContext;
import com.wangbin.agent.core.plugin.PluginRegistry;
import com.wangbin.agent.core.queue.ItemQueue;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 任务解析器
 * 把配置段和插件实例转换为任务表。每个配置段创建一个采集器实例，
 * 采集器的每种能力（LEGACY / METRIC / DISCOVERY）生成一个任务：
 * <pre>
 * memcached01-build_items           interval 60
 * memcached01-build_discovery_items lld_interval 600
 * </pre>
 * 间隔优先级：段内选项 &gt; global 选项 &gt; 任务类型默认值。
 */
@Slf4j
public class JobResolver {

    public static final String MODULE_OPTION = "module";

    public static final String PLUGIN_LOGGER_PREFIX = "agent.plugin.";

    private final PluginRegistry pluginRegistry;
    private final ItemQueue queue;
    private final ItemQueue statsQueue;

    // 已提示过废弃的插件
    private final Set<String> deprecationWarned = new HashSet<>();

    public JobResolver(PluginRegistry pluginRegistry, ItemQueue queue, ItemQueue statsQueue) {
        this.pluginRegistry = pluginRegistry;
        this.queue = queue;
        this.statsQueue = statsQueue;
    }

    /**
     * 解析全部配置段
     *
     * @param sections 段名 -> 选项，必须包含 global
     * @throws ConfigurationException 缺少module、未知插件、创建失败、间隔非法、任务名重复
     */
    public JobTable resolve(Map<String, ? extends Map<String, ?>> sections) throws ConfigurationException {
        GlobalOptions global = GlobalOptions.from(sections);
        JobTable.Builder builder = JobTable.builder();

        for (Map.Entry<String, ? extends Map<String, ?>> entry : sections.entrySet()) {
            String section = entry.getKey();
            if (GlobalOptions.SECTION.equals(section)) {
                continue;
            }
            resolveSection(new SectionOptions(section, entry.getValue()), global, builder);
        }

        JobTable table = builder.build();
        log.info("任务解析完成，共 {} 个任务: {}", table.size(), table.getNames());
        return table;
    }

    private void resolveSection(SectionOptions options, GlobalOptions global, JobTable.Builder builder) {
        String section = options.getSection();
        String module = options.getString(MODULE_OPTION);
        if (module == null || module.isEmpty()) {
            throw ConfigurationException.missingModule(section);
        }
        if (!pluginRegistry.supports(module)) {
            throw ConfigurationException.unknownModule(section, module);
        }

        CollectorContext context = CollectorContext.builder()
                .section(section)
                .module(module)
                .options(options)
                .queue(queue)
                .statsQueue(statsQueue)
                .logger(LoggerFactory.getLogger(PLUGIN_LOGGER_PREFIX + module))
                .build();
        Object collector = pluginRegistry.createCollector(context);

        int jobCount = 0;
        for (JobKind kind : JobKind.values()) {
            Optional<JobTask> task = kind.bind(collector);
            if (task.isEmpty()) {
                continue;
            }

            if (kind == JobKind.LEGACY && deprecationWarned.add(module)) {
                log.warn("{} 的 \"looped_method\" 已废弃，请改为实现 \"build_items\"", module);
            }

            double interval = resolveInterval(kind, options, global);
            builder.add(JobDescriptor.builder()
                    .name(kind.jobName(section))
                    .section(section)
                    .module(module)
                    .kind(kind)
                    .intervalSeconds(interval)
                    .task(task.get())
                    .build());
            jobCount++;

            log.info("加载插件 {} ({} {})", module, kind.getIntervalOption(), interval);
        }

        if (jobCount == 0) {
            log.warn("[{}] 插件 {} 未实现任何采集能力，不会生成任务", section, module);
        }
    }

    /**
     * 段内选项 &gt; global 选项 &gt; 默认值
     */
    static double resolveInterval(JobKind kind, SectionOptions options, GlobalOptions global) {
        String option = kind.getIntervalOption();
        return options.getPositiveDouble(option)
                .or(() -> global.getDefaultInterval(option))
                .orElse(kind.getDefaultInterval());
    }
}
