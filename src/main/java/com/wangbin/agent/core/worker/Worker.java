package com.wangbin.agent.core.worker;

import com.google.common.base.Stopwatch;
import com.wangbin.agent.common.exception.JobExecutionException;
import com.wangbin.agent.common.exception.PluginException;
import com.wangbin.agent.core.job.JobDescriptor;
import com.wangbin.agent.core.statistics.JobStatistics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * 任务执行单元
 * 先等待一个完整间隔再调用回调，循环往复。回调抛出异常时Worker终止，
 * 释放租约后由Supervisor在下一轮重新启动。
 */
@Slf4j
public class Worker implements Runnable {

    @Getter
    private final JobDescriptor job;

    private final WorkerRegistry registry;
    private final JobStatistics statistics;
    private final Sleeper sleeper;

    @Getter
    private volatile WorkerState state = WorkerState.NEW;

    private volatile Thread thread;

    // 线程启动前收到的中断也要生效
    private volatile boolean stopped;

    public Worker(JobDescriptor job, WorkerRegistry registry, JobStatistics statistics, Sleeper sleeper) {
        this.job = job;
        this.registry = registry;
        this.statistics = statistics;
        this.sleeper = sleeper;
    }

    public String getName() {
        return job.getName();
    }

    @Override
    public void run() {
        thread = Thread.currentThread();
        try {
            while (!stopped) {
                state = WorkerState.SLEEPING;
                sleeper.sleep(job.getInterval());

                state = WorkerState.EXECUTING;
                execute();
            }
            log.info("任务 {} 已停止，Worker退出", job.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("任务 {} 被中断，Worker退出", job.getName());
        } finally {
            state = WorkerState.TERMINATED;
            registry.release(this);
        }
    }

    private void execute() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            job.getTask().execute();

            long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            statistics.executionSucceeded(job.getName(), elapsed);
            log.debug("任务 {} 执行完成，耗时 {}ms", job.getName(), elapsed);
        } catch (PluginException e) {
            statistics.executionFailed(job.getName(), stopwatch.elapsed(TimeUnit.MILLISECONDS), e);
            log.error("任务 {} 插件异常: {}", job.getName(), e.getMessage(), e);
            throw new JobExecutionException(job.getName(), e);
        } catch (RuntimeException e) {
            statistics.executionFailed(job.getName(), stopwatch.elapsed(TimeUnit.MILLISECONDS), e);
            log.error("任务 {} 未预期异常", job.getName(), e);
            throw e;
        } catch (Error e) {
            statistics.executionFailed(job.getName(), stopwatch.elapsed(TimeUnit.MILLISECONDS), e);
            log.error("任务 {} 发生严重错误", job.getName(), e);
            throw e;
        }
    }

    /**
     * 中断Worker，仅在进程关闭时使用
     */
    public void interrupt() {
        stopped = true;
        Thread current = thread;
        if (current != null) {
            current.interrupt();
        }
    }

    public boolean isAlive() {
        return state != WorkerState.TERMINATED;
    }

    @Override
    public String toString() {
        return "Worker[" + job.getName() + ", " + state + "]";
    }
}
