package com.wangbin.agent.plugins.stats;

import com.wangbin.agent.common.constant.AgentConstant;
import com.wangbin.agent.common.domain.item.Item;
import com.wangbin.agent.common.domain.item.MetricItem;
import com.wangbin.agent.common.exception.PluginException;
import com.wangbin.agent.common.utils.DateUtil;
import com.wangbin.agent.common.utils.JsonUtil;
import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.plugin.AbstractCollector;
import com.wangbin.agent.core.plugin.MetricCollector;
import com.wangbin.agent.core.queue.ItemQueue;
import com.wangbin.agent.core.statistics.JobStatistics;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 内置自监控插件 agent_stats
 * 1. 把统计队列中的数据（发送端等插件写入）转入主队列
 * 2. 上报两个队列的长度与容量、各任务失败和重启次数
 */
public class StatsCollector extends AbstractCollector implements MetricCollector {

    // 单次从统计队列转移的上限
    private static final int MAX_FORWARD = 1000;

    private final JobStatistics jobStatistics;

    public StatsCollector(SectionOptions options,
                          ItemQueue queue,
                          ItemQueue statsQueue,
                          Logger logger,
                          JobStatistics jobStatistics) {
        super(options, queue, statsQueue, logger);
        this.jobStatistics = jobStatistics;
    }

    @Override
    public void buildItems() throws PluginException {
        int forwarded = forwardStats();

        String host = getHostname();
        long clock = DateUtil.getCurrentTimestamp();
        List<Item> items = new ArrayList<>();
        addQueueItems(items, queue, host, clock);
        if (statsQueue != null) {
            addQueueItems(items, statsQueue, host, clock);
        }

        Map<String, Map<String, Object>> allStatistics = jobStatistics.getAllStatistics();
        for (Map.Entry<String, Map<String, Object>> entry : allStatistics.entrySet()) {
            String jobName = entry.getKey();
            items.add(new MetricItem(String.format(AgentConstant.METRIC_JOB_FAILED, jobName),
                    entry.getValue().get("failures"), host, clock));
            items.add(new MetricItem(String.format(AgentConstant.METRIC_JOB_RESTARTS, jobName),
                    entry.getValue().get("restarts"), host, clock));
        }

        for (Item item : items) {
            enqueue(item);
        }
        logger.debug("自监控上报 {} 项，转移统计 {} 项，任务统计: {}",
                items.size(), forwarded, JsonUtil.toJsonString(allStatistics));
    }

    private int forwardStats() throws PluginException {
        if (statsQueue == null) {
            return 0;
        }
        List<Item> pending = new ArrayList<>();
        statsQueue.drainTo(pending, MAX_FORWARD);
        for (Item item : pending) {
            enqueue(item);
        }
        return pending.size();
    }

    private static void addQueueItems(List<Item> items, ItemQueue target, String host, long clock) {
        items.add(new MetricItem(String.format(AgentConstant.METRIC_QUEUE_SIZE, target.getName()),
                target.size(), host, clock));
        items.add(new MetricItem(String.format(AgentConstant.METRIC_QUEUE_CAPACITY, target.getName()),
                target.getCapacity(), host, clock));
    }
}
