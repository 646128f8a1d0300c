package com.wangbin.agent.core.config;

import com.wangbin.agent.common.exception.ConfigurationException;
import lombok.Getter;

import java.util.Map;
import java.util.Optional;

/**
 * global 配置段
 * max_queue_length 必填；interval / lld_interval 为全局默认采集间隔。
 * user、group、log_file、log_level 由守护进程侧使用，这里只透传。
 */
@Getter
public class GlobalOptions {

    public static final String SECTION = "global";

    public static final String MAX_QUEUE_LENGTH = "max_queue_length";

    private final SectionOptions options;
    private final int maxQueueLength;
    private final Double interval;
    private final Double lldInterval;
    private final String user;
    private final String group;
    private final String logFile;
    private final String logLevel;

    public GlobalOptions(SectionOptions options) {
        this.options = options;
        this.maxQueueLength = options.getPositiveInt(MAX_QUEUE_LENGTH)
                .orElseThrow(() -> new ConfigurationException(
                        String.format("[%s] 缺少 %s 选项", SECTION, MAX_QUEUE_LENGTH), SECTION));
        this.interval = options.getPositiveDouble("interval").orElse(null);
        this.lldInterval = options.getPositiveDouble("lld_interval").orElse(null);
        this.user = options.getString("user");
        this.group = options.getString("group");
        this.logFile = options.getString("log_file");
        this.logLevel = options.getString("log_level");
    }

    /**
     * 从全部配置段中取出 global 段
     */
    public static GlobalOptions from(Map<String, ? extends Map<String, ?>> sections) {
        Map<String, ?> global = sections == null ? null : sections.get(SECTION);
        if (global == null) {
            throw new ConfigurationException("缺少 [global] 配置段", SECTION);
        }
        return new GlobalOptions(new SectionOptions(SECTION, global));
    }

    public Optional<Double> getDefaultInterval(String option) {
        return options.getPositiveDouble(option);
    }
}
