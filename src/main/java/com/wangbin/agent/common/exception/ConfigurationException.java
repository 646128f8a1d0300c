package com.wangbin.agent.common.exception;

import lombok.Getter;

/**
 * 配置异常
 * 启动阶段致命，不重试
 */
@Getter
public class ConfigurationException extends AgentException {

    private final String section;

    public ConfigurationException(String message) {
        this(message, null);
    }

    public ConfigurationException(String message, String section) {
        super(400, message);
        this.section = section;
    }

    public ConfigurationException(String message, String section, Throwable cause) {
        super(400, message, cause);
        this.section = section;
    }

    // 缺少module选项
    public static ConfigurationException missingModule(String section) {
        return new ConfigurationException(
                String.format("[%s] 缺少 module 选项", section), section);
    }

    // 未注册的插件
    public static ConfigurationException unknownModule(String section, String module) {
        return new ConfigurationException(
                String.format("[%s] 未知的插件: %s", section, module), section);
    }

    // 任务名重复
    public static ConfigurationException duplicateJob(String section, String jobName) {
        return new ConfigurationException(
                String.format("[%s] 任务名重复: %s", section, jobName), section);
    }

    // 数值非法
    public static ConfigurationException invalidValue(String section, String option, Object value) {
        return new ConfigurationException(
                String.format("[%s] 选项 %s 的值非法: %s", section, option, value), section);
    }
}
