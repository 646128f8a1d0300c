package com.wangbin.agent.core.plugin;

import com.wangbin.agent.common.exception.PluginException;

/**
 * 低级发现（LLD）采集能力
 */
public interface DiscoveryCollector {

    /**
     * 按 lld_interval 周期调用，结果以 DiscoveryItem 放入队列
     */
    void buildDiscoveryItems() throws PluginException;
}
