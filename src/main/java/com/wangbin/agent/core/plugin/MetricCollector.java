package com.wangbin.agent.core.plugin;

import com.wangbin.agent.common.exception.PluginException;

/**
 * 监控项采集能力
 */
public interface MetricCollector {

    /**
     * 按 interval 周期调用，采集结果由实现自行放入队列
     */
    void buildItems() throws PluginException;
}
