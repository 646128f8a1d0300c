package com.wangbin.agent.core.plugin;

import lombok.Getter;

/**
 * 插件注册项：模块名 -> 采集器类型或创建器
 * 声明为Spring Bean后由 {@link PluginRegistry} 自动收集。
 */
@Getter
public class PluginDefinition {

    private final String module;
    private final Class<?> collectorType;
    private final PluginRegistry.CollectorCreator creator;

    private PluginDefinition(String module, Class<?> collectorType, PluginRegistry.CollectorCreator creator) {
        this.module = module;
        this.collectorType = collectorType;
        this.creator = creator;
    }

    public static PluginDefinition of(String module, Class<?> collectorType) {
        return new PluginDefinition(module, collectorType, null);
    }

    public static PluginDefinition of(String module, PluginRegistry.CollectorCreator creator) {
        return new PluginDefinition(module, null, creator);
    }
}
