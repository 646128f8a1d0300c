package com.wangbin.agent.core.statistics;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 任务统计管理器
 */
public class JobStatistics {

    // 任务统计：jobName -> JobCounters
    private final Map<String, JobCounters> jobStatistics = new ConcurrentHashMap<>();

    /**
     * Worker启动
     *
     * @return 该任务此前是否已启动过（即本次为重启）
     */
    public boolean workerStarted(String jobName) {
        JobCounters counters = counters(jobName);
        boolean restart = counters.starts.getAndIncrement() > 0;
        if (restart) {
            counters.restarts.incrementAndGet();
        }
        return restart;
    }

    /**
     * 执行成功
     */
    public void executionSucceeded(String jobName, long executionMillis) {
        JobCounters counters = counters(jobName);
        counters.successes.incrementAndGet();
        counters.lastExecutionMillis = executionMillis;
    }

    /**
     * 执行失败
     */
    public void executionFailed(String jobName, long executionMillis, Throwable error) {
        JobCounters counters = counters(jobName);
        counters.failures.incrementAndGet();
        counters.lastExecutionMillis = executionMillis;
        counters.lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    public long getFailures(String jobName) {
        JobCounters counters = jobStatistics.get(jobName);
        return counters == null ? 0 : counters.failures.get();
    }

    public long getRestarts(String jobName) {
        JobCounters counters = jobStatistics.get(jobName);
        return counters == null ? 0 : counters.restarts.get();
    }

    /**
     * 获取任务统计
     */
    public Map<String, Object> getStatistics(String jobName) {
        JobCounters counters = jobStatistics.get(jobName);
        if (counters != null) {
            return counters.toMap();
        }
        return Collections.emptyMap();
    }

    /**
     * 获取所有任务统计，按任务名排序
     */
    public Map<String, Map<String, Object>> getAllStatistics() {
        Map<String, Map<String, Object>> allStats = new TreeMap<>();
        for (Map.Entry<String, JobCounters> entry : jobStatistics.entrySet()) {
            allStats.put(entry.getKey(), entry.getValue().toMap());
        }
        return Collections.unmodifiableMap(allStats);
    }

    public void clearAllStatistics() {
        jobStatistics.clear();
    }

    private JobCounters counters(String jobName) {
        return jobStatistics.computeIfAbsent(jobName, k -> new JobCounters());
    }

    @Getter
    private static class JobCounters {
        private final AtomicLong starts = new AtomicLong();
        private final AtomicLong restarts = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private volatile long lastExecutionMillis;
        private volatile String lastError;

        Map<String, Object> toMap() {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("starts", starts.get());
            stats.put("restarts", restarts.get());
            stats.put("successes", successes.get());
            stats.put("failures", failures.get());
            stats.put("lastExecutionMillis", lastExecutionMillis);
            stats.put("lastError", lastError);
            return Collections.unmodifiableMap(stats);
        }
    }
}
