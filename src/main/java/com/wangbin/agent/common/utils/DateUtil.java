package com.wangbin.agent.common.utils;

import java.time.Clock;
import java.time.Instant;

/**
 * 日期时间工具类
 */
public class DateUtil {

    private DateUtil() {
        // 工具类，防止实例化
    }

    /**
     * 获取当前UTC时间戳（秒）
     */
    public static long getCurrentTimestamp() {
        return getTimestamp(Clock.systemUTC());
    }

    /**
     * 按指定时钟获取时间戳（秒）
     */
    public static long getTimestamp(Clock clock) {
        return Instant.now(clock).getEpochSecond();
    }
}
