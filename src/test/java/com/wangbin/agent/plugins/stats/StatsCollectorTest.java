package com.wangbin.agent.plugins.stats;

import com.wangbin.agent.common.domain.item.Item;
import com.wangbin.agent.common.domain.item.MetricItem;
import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.queue.ItemQueue;
import com.wangbin.agent.core.statistics.JobStatistics;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StatsCollectorTest {

    @Test
    void forwardsStatsQueueAndReportsQueueAndJobMetrics() throws Exception {
        ItemQueue queue = new ItemQueue("items", 100);
        ItemQueue statsQueue = new ItemQueue("stats", 100);
        statsQueue.put(new MetricItem("sender.sent", 42, "node1", 1L));

        JobStatistics statistics = new JobStatistics();
        statistics.workerStarted("web01-build_items");
        statistics.workerStarted("web01-build_items");
        statistics.executionFailed("web01-build_items", 5, new IllegalStateException("down"));

        StatsCollector collector = new StatsCollector(
                new SectionOptions("self", Map.of("module", "agent_stats", "hostname", "agent-host")),
                queue, statsQueue, LoggerFactory.getLogger("agent.plugin.agent_stats"), statistics);

        collector.buildItems();

        List<Item> items = new ArrayList<>();
        queue.drainTo(items, 100);
        assertTrue(statsQueue.isEmpty());
        assertEquals("sender.sent", items.get(0).getKey(), "forwarded stats come first");

        Map<String, Item> byKey = items.stream().collect(Collectors.toMap(Item::getKey, Function.identity()));
        assertEquals(1, byKey.get("agent.queue.items.size").getValue());
        assertEquals(100, byKey.get("agent.queue.items.capacity").getValue());
        assertEquals(0, byKey.get("agent.queue.stats.size").getValue());
        assertEquals(1L, byKey.get("agent.job.failed[web01-build_items]").getValue());
        assertEquals(1L, byKey.get("agent.job.restarts[web01-build_items]").getValue());
        assertEquals("agent-host", byKey.get("agent.queue.items.size").getHost());
    }
}
