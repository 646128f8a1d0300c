package com.wangbin.agent.common.constant;

/**
 * Agent常量
 */
public class AgentConstant {

    // 队列名
    public static final String QUEUE_ITEMS = "items";
    public static final String QUEUE_STATS = "stats";

    // 线程名
    public static final String THREAD_SUPERVISOR = "agent-supervisor";
    public static final String THREAD_WORKER = "agent-worker";

    // 内置插件
    public static final String MODULE_AGENT_STATS = "agent_stats";

    // 自监控指标
    public static final String METRIC_QUEUE_SIZE = "agent.queue.%s.size";
    public static final String METRIC_QUEUE_CAPACITY = "agent.queue.%s.capacity";
    public static final String METRIC_JOB_FAILED = "agent.job.failed[%s]";
    public static final String METRIC_JOB_RESTARTS = "agent.job.restarts[%s]";

    private AgentConstant() {
    }
}
