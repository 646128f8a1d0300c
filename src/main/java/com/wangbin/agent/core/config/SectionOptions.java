package com.wangbin.agent.core.config;

import com.wangbin.agent.common.exception.ConfigurationException;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 单个配置段的选项
 * 选项名匹配时忽略大小写以及 '-'、'_'，max_queue_length 与 max-queue-length 等价。
 */
public class SectionOptions {

    @Getter
    private final String section;

    private final Map<String, Object> options;
    private final Map<String, Object> normalized = new LinkedHashMap<>();

    public SectionOptions(String section, Map<String, ?> options) {
        this.section = section;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (options != null) {
            copy.putAll(options);
        }
        this.options = Collections.unmodifiableMap(copy);
        for (Map.Entry<String, Object> entry : copy.entrySet()) {
            normalized.put(normalizeKey(entry.getKey()), entry.getValue());
        }
    }

    public static String normalizeKey(String key) {
        return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    public boolean contains(String name) {
        return normalized.get(normalizeKey(name)) != null;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(normalized.get(normalizeKey(name)));
    }

    public String getString(String name) {
        return get(name).map(String::valueOf).map(String::trim).orElse(null);
    }

    public String getString(String name, String defaultValue) {
        String value = getString(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    /**
     * 读取正数选项（秒数等），不存在时返回 empty
     */
    public Optional<Double> getPositiveDouble(String name) {
        Optional<Object> raw = get(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        double value = parseDouble(name, raw.get());
        if (!(value > 0) || Double.isInfinite(value)) {
            throw ConfigurationException.invalidValue(section, name, raw.get());
        }
        return Optional.of(value);
    }

    /**
     * 读取正整数选项，不存在时返回 empty
     */
    public Optional<Integer> getPositiveInt(String name) {
        Optional<Object> raw = get(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Object value = raw.get();
        try {
            int parsed = value instanceof Number number ? toExactInt(number) : Integer.parseInt(value.toString().trim());
            if (parsed <= 0) {
                throw ConfigurationException.invalidValue(section, name, value);
            }
            return Optional.of(parsed);
        } catch (ArithmeticException e) {
            throw ConfigurationException.invalidValue(section, name, value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("[%s] 选项 %s 不是整数: %s", section, name, value), section, e);
        }
    }

    // 不允许截断：小数和超出 int 范围的值都视为非法
    private static int toExactInt(Number number) {
        double asDouble = number.doubleValue();
        if (asDouble != Math.rint(asDouble) || Double.isInfinite(asDouble)) {
            throw new ArithmeticException("not an integer: " + number);
        }
        return Math.toIntExact(number.longValue());
    }

    private double parseDouble(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("[%s] 选项 %s 不是数字: %s", section, name, value), section, e);
        }
    }

    public Map<String, Object> asMap() {
        return options;
    }

    @Override
    public String toString() {
        return "[" + section + "] " + options;
    }
}
