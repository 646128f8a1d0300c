package com.wangbin.agent.common.domain.item;

import com.wangbin.agent.common.utils.JsonUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 低级发现（LLD）数据项
 * <pre>
 * {
 *   "host": "example.com",
 *   "clock": 946652400,
 *   "key": "sample.LLD",
 *   "value": "{\"data\": [{\"{#HOSTNAME}\": \"host001\"}, {\"{#HOSTNAME}\": \"host002\"}]}"
 * }
 * </pre>
 * value 在构造时即编码为JSON文本。
 */
public class DiscoveryItem extends Item {

    private final List<Map<String, ?>> value;
    private final Map<String, Object> data;

    public DiscoveryItem(String key, List<? extends Map<String, ?>> value, String host) {
        this(key, value, host, null);
    }

    public DiscoveryItem(String key, List<? extends Map<String, ?>> value, String host, Long clock) {
        super(key, host, clock);
        this.value = Collections.unmodifiableList(new ArrayList<Map<String, ?>>(Objects.requireNonNull(value, "value")));

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("data", this.value);

        Map<String, Object> generated = new LinkedHashMap<>();
        generated.put("host", getHost());
        generated.put("clock", getClock());
        generated.put("key", getKey());
        generated.put("value", JsonUtil.toLldJson(envelope));
        this.data = Collections.unmodifiableMap(generated);
    }

    @Override
    public List<Map<String, ?>> getValue() {
        return value;
    }

    @Override
    public Map<String, Object> getData() {
        return data;
    }
}
