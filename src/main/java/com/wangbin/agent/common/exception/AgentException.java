package com.wangbin.agent.common.exception;

import lombok.Getter;

/**
 * Agent基础异常
 */
@Getter
public class AgentException extends RuntimeException {

    private final int code;

    public AgentException(int code, String message) {
        super(message);
        this.code = code;
    }

    public AgentException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
