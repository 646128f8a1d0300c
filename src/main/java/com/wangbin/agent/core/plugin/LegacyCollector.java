package com.wangbin.agent.core.plugin;

import com.wangbin.agent.common.exception.PluginException;

/**
 * 旧版单回调采集器
 *
 * @deprecated 请实现 {@link MetricCollector#buildItems()}，多数情况下只需改方法名
 */
@Deprecated
public interface LegacyCollector {

    void loopedMethod() throws PluginException;
}
