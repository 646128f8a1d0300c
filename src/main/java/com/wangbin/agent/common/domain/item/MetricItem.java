package com.wangbin.agent.common.domain.item;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 监控项数据
 * data: {key, value, host, clock}
 */
public class MetricItem extends Item {

    private final Object value;
    private final Map<String, Object> data;

    public MetricItem(String key, Object value) {
        this(key, value, null, null);
    }

    public MetricItem(String key, Object value, String host) {
        this(key, value, host, null);
    }

    public MetricItem(String key, Object value, String host, Long clock) {
        super(key, host, clock);
        this.value = value;

        Map<String, Object> generated = new LinkedHashMap<>();
        generated.put("key", getKey());
        generated.put("value", value);
        generated.put("host", getHost());
        generated.put("clock", getClock());
        this.data = Collections.unmodifiableMap(generated);
    }

    @Override
    public Object getValue() {
        return value;
    }

    @Override
    public Map<String, Object> getData() {
        return data;
    }
}
