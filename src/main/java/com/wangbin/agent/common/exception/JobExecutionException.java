package com.wangbin.agent.common.exception;

import lombok.Getter;

/**
 * 任务执行致命异常，Worker以此终止
 */
@Getter
public class JobExecutionException extends AgentException {

    private final String jobName;

    public JobExecutionException(String jobName, Throwable cause) {
        super(500, String.format("任务 %s 执行失败: %s", jobName, cause.getMessage()), cause);
        this.jobName = jobName;
    }
}
