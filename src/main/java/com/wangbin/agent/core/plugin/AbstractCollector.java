package com.wangbin.agent.core.plugin;

import com.wangbin.agent.common.domain.item.Item;
import com.wangbin.agent.common.exception.PluginException;
import com.wangbin.agent.common.utils.HostUtil;
import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.queue.ItemQueue;
import lombok.Getter;
import org.slf4j.Logger;

/**
 * 采集器基类
 * 子类通过构造函数签名声明是否需要统计队列：
 * (SectionOptions, ItemQueue, ItemQueue, Logger) 会收到 statsQueue，
 * (SectionOptions, ItemQueue, Logger) 则不会。
 */
@Getter
public abstract class AbstractCollector {

    protected final SectionOptions options;
    protected final ItemQueue queue;
    protected final ItemQueue statsQueue;
    protected final Logger logger;

    protected AbstractCollector(SectionOptions options, ItemQueue queue, Logger logger) {
        this(options, queue, null, logger);
    }

    protected AbstractCollector(SectionOptions options, ItemQueue queue, ItemQueue statsQueue, Logger logger) {
        this.options = options;
        this.queue = queue;
        this.statsQueue = statsQueue;
        this.logger = logger;
    }

    /**
     * 放入主队列，队列满时阻塞
     */
    protected void enqueue(Item item) throws PluginException {
        put(queue, item);
    }

    /**
     * 放入统计队列
     */
    protected void enqueueStats(Item item) throws PluginException {
        if (statsQueue == null) {
            throw new PluginException("未注入统计队列: " + options.getSection(), getModule(), null);
        }
        put(statsQueue, item);
    }

    private void put(ItemQueue target, Item item) throws PluginException {
        try {
            target.put(item);
            logger.debug("入队 {}: {}", target.getName(), item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PluginException.interrupted(getModule(), e);
        }
    }

    /**
     * 监控对象主机名：hostname 选项，否则为本机
     */
    public String getHostname() {
        return options.getString("hostname", HostUtil.getLocalHostname());
    }

    public String getModule() {
        return options.getString("module");
    }
}
