package com.wangbin.agent.common.exception;

import lombok.Getter;

/**
 * 插件异常
 * 采集器在回调中遇到可预期的错误时应抛出此异常，而不是内置异常。
 * Worker捕获后记录错误并终止，由Supervisor在下一轮重新拉起。
 */
@Getter
public class PluginException extends AgentException {

    private final String module;

    public PluginException(String message) {
        this(message, null, null);
    }

    public PluginException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PluginException(String message, String module, Throwable cause) {
        super(500, message, cause);
        this.module = module;
    }

    // 入队被中断
    public static PluginException interrupted(String module, InterruptedException cause) {
        return new PluginException(String.format("%s 入队被中断", module), module, cause);
    }
}
