package com.wangbin.agent.core.supervisor;

import com.wangbin.agent.core.job.JobDescriptor;
import com.wangbin.agent.core.job.JobTable;
import com.wangbin.agent.core.statistics.JobStatistics;
import com.wangbin.agent.core.worker.Sleeper;
import com.wangbin.agent.core.worker.Worker;
import com.wangbin.agent.core.worker.WorkerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 任务Supervisor
 * 按固定周期巡检：任务表中没有存活Worker的任务立即启动新Worker，
 * 存活的Worker不做任何处理。Worker无论因何终止都会在下一轮被重新拉起，
 * 不退避、不限次数。卡死的Worker不会被检测或替换。
 */
@Slf4j
public class JobSupervisor {

    private final JobTable jobTable;
    private final WorkerRegistry workerRegistry;
    private final JobStatistics jobStatistics;
    private final ThreadFactory workerThreadFactory;
    private final ScheduledExecutorService supervisorScheduler;
    private final Duration pollPeriod;
    private final Sleeper sleeper;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public JobSupervisor(JobTable jobTable,
                         WorkerRegistry workerRegistry,
                         JobStatistics jobStatistics,
                         ThreadFactory workerThreadFactory,
                         ScheduledExecutorService supervisorScheduler,
                         Duration pollPeriod,
                         Sleeper sleeper) {
        this.jobTable = jobTable;
        this.workerRegistry = workerRegistry;
        this.jobStatistics = jobStatistics;
        this.workerThreadFactory = workerThreadFactory;
        this.supervisorScheduler = supervisorScheduler;
        this.pollPeriod = pollPeriod;
        this.sleeper = sleeper;
    }

    /**
     * 启动巡检循环
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Supervisor已在运行");
            return;
        }
        supervisorScheduler.scheduleWithFixedDelay(this::superviseSafely,
                0, pollPeriod.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Supervisor已启动，任务数: {}, 巡检周期: {}ms", jobTable.size(), pollPeriod.toMillis());
    }

    /**
     * 执行一轮巡检
     *
     * @return 本轮启动的Worker数量
     */
    public int superviseOnce() {
        Set<String> liveJobNames = workerRegistry.liveJobNames();

        int started = 0;
        for (JobDescriptor job : jobTable.getJobs()) {
            if (liveJobNames.contains(job.getName())) {
                continue;
            }
            if (startWorker(job) != null) {
                started++;
            }
        }
        return started;
    }

    private void superviseSafely() {
        try {
            superviseOnce();
        } catch (Exception e) {
            log.error("Supervisor巡检异常", e);
        }
    }

    /**
     * 登记租约并启动Worker线程
     *
     * @return 已有同名存活Worker时返回 null
     */
    Worker startWorker(JobDescriptor job) {
        Worker worker = new Worker(job, workerRegistry, jobStatistics, sleeper);
        if (!workerRegistry.acquire(worker)) {
            log.debug("任务 {} 已有存活Worker，跳过", job.getName());
            return null;
        }

        try {
            Thread thread = workerThreadFactory.newThread(worker);
            thread.setName(job.getName());
            thread.start();
        } catch (RuntimeException e) {
            workerRegistry.release(worker);
            throw e;
        }

        if (jobStatistics.workerStarted(job.getName())) {
            log.warn("重启任务 {}，累计重启 {} 次", job.getName(), jobStatistics.getRestarts(job.getName()));
        } else {
            log.info("启动任务 {} (interval {}s)", job.getName(), job.getIntervalSeconds());
        }
        return worker;
    }

    /**
     * 停止巡检并中断所有Worker，仅在进程关闭时调用
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        supervisorScheduler.shutdownNow();
        for (Worker worker : workerRegistry.getWorkers()) {
            worker.interrupt();
        }
        log.info("Supervisor已停止");
    }

    public boolean isRunning() {
        return running.get();
    }
}
