package com.wangbin.agent.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.agent.common.constant.AgentConstant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Supervisor巡检线程（非守护线程，维持进程存活）
     */
    @Bean(name = "supervisorScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService supervisorScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1,
                new ThreadFactoryBuilder()
                        .setNameFormat(AgentConstant.THREAD_SUPERVISOR + "-%d")
                        .setDaemon(false)
                        .build());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Worker线程工厂（守护线程，启动后以任务名命名）
     * Worker终止前已记录异常，这里只留调试日志
     */
    @Bean(name = "workerThreadFactory")
    public ThreadFactory workerThreadFactory() {
        return new ThreadFactoryBuilder()
                .setNameFormat(AgentConstant.THREAD_WORKER + "-%d")
                .setDaemon(true)
                .setPriority(Thread.NORM_PRIORITY)
                .setUncaughtExceptionHandler((thread, error) ->
                        log.debug("Worker线程 {} 终止: {}", thread.getName(), error.toString()))
                .build();
    }
}
