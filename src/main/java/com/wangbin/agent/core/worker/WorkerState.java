package com.wangbin.agent.core.worker;

/**
 * Worker状态：NEW → SLEEPING → EXECUTING → SLEEPING → … → TERMINATED
 */
public enum WorkerState {
    NEW,
    SLEEPING,
    EXECUTING,
    TERMINATED
}
