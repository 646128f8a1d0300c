package com.wangbin.agent;

import com.wangbin.agent.core.job.JobKind;
import com.wangbin.agent.core.job.JobTable;
import com.wangbin.agent.core.plugin.PluginRegistry;
import com.wangbin.agent.core.queue.ItemQueue;
import com.wangbin.agent.core.supervisor.JobSupervisor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "agent.supervisor.poll-period=200ms",
        "agent.sections.global.max-queue-length=64",
        "agent.sections.global.lld-interval=120",
        "agent.sections.agent-self.interval=45"
})
class AgentApplicationTest {

    @Autowired
    private JobTable jobTable;

    @Autowired
    private PluginRegistry pluginRegistry;

    @Autowired
    @Qualifier("itemQueue")
    private ItemQueue itemQueue;

    @Autowired
    @Qualifier("statsQueue")
    private ItemQueue statsQueue;

    @Autowired
    private JobSupervisor jobSupervisor;

    @Test
    void contextResolvesBuiltInStatsJob() {
        assertTrue(pluginRegistry.supports("agent_stats"));
        assertEquals(1, jobTable.size());
        assertEquals(JobKind.METRIC, jobTable.get("agent-self-build_items").getKind());
        assertEquals(45.0, jobTable.get("agent-self-build_items").getIntervalSeconds());

        assertEquals(64, itemQueue.getCapacity());
        assertEquals(64, statsQueue.getCapacity());
        assertTrue(jobSupervisor.isRunning());
    }
}
