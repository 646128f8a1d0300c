package com.wangbin.agent.core.job;

import com.wangbin.agent.common.exception.PluginException;

/**
 * 采集回调
 */
@FunctionalInterface
public interface JobTask {

    void execute() throws PluginException;
}
