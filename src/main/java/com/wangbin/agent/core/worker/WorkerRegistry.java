package com.wangbin.agent.core.worker;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Worker租约表：任务名 -> 存活的Worker
 * Supervisor在启动Worker前登记，Worker终止时自行注销。
 */
public class WorkerRegistry {

    private final ConcurrentMap<String, Worker> leases = new ConcurrentHashMap<>();

    /**
     * 登记租约
     *
     * @return 同名任务已有存活Worker时返回 false
     */
    public boolean acquire(Worker worker) {
        return leases.putIfAbsent(worker.getName(), worker) == null;
    }

    /**
     * 注销租约，只有仍持有租约的Worker才能注销
     */
    public boolean release(Worker worker) {
        return leases.remove(worker.getName(), worker);
    }

    /**
     * 存活任务名快照
     */
    public Set<String> liveJobNames() {
        return Set.copyOf(leases.keySet());
    }

    public boolean isLive(String jobName) {
        return leases.containsKey(jobName);
    }

    public Worker get(String jobName) {
        return leases.get(jobName);
    }

    public Collection<Worker> getWorkers() {
        return List.copyOf(leases.values());
    }

    public int size() {
        return leases.size();
    }
}
