package com.wangbin.agent.core.plugin;

import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.queue.ItemQueue;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;

/**
 * 构造采集器所需的上下文
 */
@Getter
@Builder
public class CollectorContext {

    private final String section;
    private final String module;
    private final SectionOptions options;
    private final ItemQueue queue;
    private final ItemQueue statsQueue;
    private final Logger logger;
}
