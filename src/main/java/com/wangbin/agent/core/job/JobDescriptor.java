package com.wangbin.agent.core.job;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;

/**
 * 任务描述：名称唯一，同时作为Worker存活登记的键
 */
@Getter
@Builder
@ToString(exclude = "task")
public class JobDescriptor {

    @NonNull
    private final String name;

    private final String section;

    private final String module;

    @NonNull
    private final JobKind kind;

    /**
     * 采集间隔（秒）
     */
    private final double intervalSeconds;

    @NonNull
    private final JobTask task;

    public Duration getInterval() {
        return Duration.ofNanos(Math.round(intervalSeconds * 1_000_000_000d));
    }
}
