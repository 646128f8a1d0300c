package com.wangbin.agent;

import com.wangbin.agent.core.config.GlobalOptions;
import com.wangbin.agent.core.job.JobTable;
import com.wangbin.agent.core.supervisor.JobSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 上下文就绪后启动Supervisor，之后进程一直运行直到收到外部信号
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentRunner implements CommandLineRunner {

    private final JobSupervisor jobSupervisor;
    private final JobTable jobTable;
    private final GlobalOptions globalOptions;

    @Override
    public void run(String... args) {
        log.info("agent {} : 启动主流程，任务 {} 个，队列容量 {}",
                getVersion(), jobTable.size(), globalOptions.getMaxQueueLength());
        if (jobTable.isEmpty()) {
            log.warn("没有配置任何任务");
        }
        jobSupervisor.start();
    }

    static String getVersion() {
        String version = AgentApplication.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }
}
