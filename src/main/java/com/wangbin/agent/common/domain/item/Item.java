package com.wangbin.agent.common.domain.item;

import com.wangbin.agent.common.utils.DateUtil;
import com.wangbin.agent.common.utils.HostUtil;
import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * 入队数据项基类
 * 保存原始值（key、value、host、clock），出队时以 {@link #getData()} 的格式交给发送端。
 * 构造后不可变，clock 为构造时刻的快照。
 */
@Getter
public abstract class Item {

    private final String key;
    private final String host;
    private final long clock;

    protected Item(String key, String host, Long clock) {
        this.key = Objects.requireNonNull(key, "key");
        this.host = host == null || host.isBlank() ? HostUtil.getLocalHostname() : host;
        this.clock = clock == null ? DateUtil.getCurrentTimestamp() : clock;
    }

    /**
     * 原始值
     */
    public abstract Object getValue();

    /**
     * 出队时的数据格式
     */
    public abstract Map<String, Object> getData();

    @Override
    public String toString() {
        return getClass().getSimpleName() + getData();
    }
}
