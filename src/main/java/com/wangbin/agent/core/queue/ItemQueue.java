package com.wangbin.agent.core.queue;

import com.wangbin.agent.common.domain.item.Item;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 有界数据项队列，所有Worker共享（生产者），由外部发送端消费。
 * 队列满时 put 阻塞，形成背压，从不丢弃数据。
 */
@Slf4j
public class ItemQueue {

    @Getter
    private final String name;

    @Getter
    private final int capacity;

    private final BlockingQueue<Item> queue;

    public ItemQueue(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("队列容量必须为正数: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * 入队，队列满时阻塞直到有空间
     */
    public void put(Item item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        if (queue.remainingCapacity() == 0) {
            log.debug("队列 {} 已满({})，等待消费", name, capacity);
        }
        queue.put(item);
    }

    /**
     * 限时入队
     *
     * @return 超时仍无空间时返回 false
     */
    public boolean offer(Item item, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        return queue.offer(item, timeout, unit);
    }

    /**
     * 出队，队列空时阻塞
     */
    public Item take() throws InterruptedException {
        return queue.take();
    }

    /**
     * 限时出队，超时返回 null
     */
    public Item poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * 批量取出
     */
    public int drainTo(Collection<? super Item> target, int maxElements) {
        return queue.drainTo(target, maxElements);
    }

    public int size() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public String toString() {
        return "ItemQueue[" + name + ", " + queue.size() + "/" + capacity + "]";
    }
}
