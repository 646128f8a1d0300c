package com.wangbin.agent.core.job;

import com.wangbin.agent.core.plugin.DiscoveryCollector;
import com.wangbin.agent.core.plugin.LegacyCollector;
import com.wangbin.agent.core.plugin.MetricCollector;
import lombok.Getter;

import java.util.Optional;

/**
 * 任务类型
 * 一个采集器可同时具备多种能力，每种能力对应一个任务。
 */
@Getter
public enum JobKind {

    /**
     * 已废弃的 looped_method
     */
    LEGACY("looped_method", "interval", 60) {
        @Override
        @SuppressWarnings("deprecation")
        public Optional<JobTask> bind(Object collector) {
            if (collector instanceof LegacyCollector legacy) {
                return Optional.of(legacy::loopedMethod);
            }
            return Optional.empty();
        }
    },

    METRIC("build_items", "interval", 60) {
        @Override
        public Optional<JobTask> bind(Object collector) {
            if (collector instanceof MetricCollector metric) {
                return Optional.of(metric::buildItems);
            }
            return Optional.empty();
        }
    },

    DISCOVERY("build_discovery_items", "lld_interval", 600) {
        @Override
        public Optional<JobTask> bind(Object collector) {
            if (collector instanceof DiscoveryCollector discovery) {
                return Optional.of(discovery::buildDiscoveryItems);
            }
            return Optional.empty();
        }
    };

    /**
     * 任务名后缀
     */
    private final String methodName;

    /**
     * 间隔选项名
     */
    private final String intervalOption;

    /**
     * 默认间隔（秒）
     */
    private final double defaultInterval;

    JobKind(String methodName, String intervalOption, double defaultInterval) {
        this.methodName = methodName;
        this.intervalOption = intervalOption;
        this.defaultInterval = defaultInterval;
    }

    /**
     * 采集器具备该能力时返回对应回调
     */
    public abstract Optional<JobTask> bind(Object collector);

    /**
     * 任务名：段名-方法名
     */
    public String jobName(String section) {
        return section + "-" + methodName;
    }
}
