package com.wangbin.agent.core.plugin;

import com.wangbin.agent.common.exception.ConfigurationException;
import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.queue.ItemQueue;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 插件注册表：模块名 -> 采集器
 * 按类型注册时，根据构造函数签名判断采集器是否需要统计队列。
 */
@Slf4j
public class PluginRegistry {

    private final Map<String, CollectorCreator> collectorCreators = new ConcurrentHashMap<>();

    public PluginRegistry() {
        this(Collections.emptyList());
    }

    public PluginRegistry(List<PluginDefinition> definitions) {
        for (PluginDefinition definition : definitions) {
            if (definition.getCreator() != null) {
                register(definition.getModule(), definition.getCreator());
            } else {
                register(definition.getModule(), definition.getCollectorType());
            }
        }
        log.info("插件注册表初始化完成，共 {} 个插件", collectorCreators.size());
    }

    /**
     * 按类型注册
     */
    public void register(String module, Class<?> collectorType) {
        register(module, context -> instantiateCollector(collectorType, context));
    }

    /**
     * 按创建器注册
     */
    public void register(String module, CollectorCreator creator) {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("模块名不能为空");
        }
        CollectorCreator previous = collectorCreators.put(module, creator);
        if (previous != null) {
            log.warn("插件 {} 被重复注册，后注册的生效", module);
        } else {
            log.debug("注册插件: {}", module);
        }
    }

    public boolean supports(String module) {
        return module != null && collectorCreators.containsKey(module);
    }

    public Set<String> getModules() {
        return Collections.unmodifiableSet(collectorCreators.keySet());
    }

    /**
     * 创建采集器实例
     */
    public Object createCollector(CollectorContext context) throws ConfigurationException {
        CollectorCreator creator = collectorCreators.get(context.getModule());
        if (creator == null) {
            throw ConfigurationException.unknownModule(context.getSection(), context.getModule());
        }

        try {
            Object collector = creator.create(context);
            if (collector == null) {
                throw new ConfigurationException(
                        String.format("[%s] 插件 %s 创建结果为空", context.getSection(), context.getModule()),
                        context.getSection());
            }
            log.debug("采集器创建成功: {} [{}]", context.getSection(), context.getModule());
            return collector;
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            log.error("采集器创建失败: {} [{}]", context.getSection(), context.getModule(), e);
            throw new ConfigurationException(
                    String.format("[%s] 插件 %s 创建失败: %s", context.getSection(), context.getModule(), e.getMessage()),
                    context.getSection(), e);
        }
    }

    /**
     * 优先使用带 statsQueue 的构造函数
     */
    static Object instantiateCollector(Class<?> collectorType, CollectorContext context) throws Exception {
        Constructor<?> withStats = findConstructor(collectorType,
                SectionOptions.class, ItemQueue.class, ItemQueue.class, Logger.class);
        try {
            if (withStats != null) {
                return withStats.newInstance(
                        context.getOptions(), context.getQueue(), context.getStatsQueue(), context.getLogger());
            }

            Constructor<?> plain = findConstructor(collectorType,
                    SectionOptions.class, ItemQueue.class, Logger.class);
            if (plain != null) {
                return plain.newInstance(context.getOptions(), context.getQueue(), context.getLogger());
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }

        throw new ConfigurationException(
                String.format("[%s] %s 没有可用的构造函数 (options, queue, [statsQueue,] logger)",
                        context.getSection(), collectorType.getName()),
                context.getSection());
    }

    private static Constructor<?> findConstructor(Class<?> type, Class<?>... parameterTypes) {
        try {
            return type.getConstructor(parameterTypes);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /**
     * 采集器创建器接口
     */
    @FunctionalInterface
    public interface CollectorCreator {
        Object create(CollectorContext context) throws Exception;
    }
}
