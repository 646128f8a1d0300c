package com.wangbin.agent.common.utils;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 主机名工具类
 */
@Slf4j
public class HostUtil {

    private static final String FALLBACK_HOSTNAME = "localhost";

    private static volatile String localHostname;

    private HostUtil() {
        // 工具类，防止实例化
    }

    /**
     * 本机主机名，首次解析后缓存
     */
    public static String getLocalHostname() {
        String hostname = localHostname;
        if (hostname == null) {
            hostname = resolveHostname();
            localHostname = hostname;
        }
        return hostname;
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("无法解析本机主机名，使用 {}", FALLBACK_HOSTNAME, e);
            return FALLBACK_HOSTNAME;
        }
    }
}
