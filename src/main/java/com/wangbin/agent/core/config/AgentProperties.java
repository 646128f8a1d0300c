package com.wangbin.agent.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * agent 配置映射
 * <pre>
 * agent:
 *   sections:
 *     global:
 *       max_queue_length: 32767
 *     memcached01:
 *       module: memcached
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    /**
     * Supervisor配置
     */
    private Supervisor supervisor = new Supervisor();

    /**
     * 配置段：段名 -> 选项，必须包含 global 段
     * <p>
     * 绑定 Map 时 Spring 会去掉键名中的下划线，{@code web_1} 与 {@code web1} 会被合并为同一段且不报错。
     * 段名请使用中划线（{@code web-1}），或用方括号保留原样（{@code "[web_1]"}）。
     * 段内选项名不受影响，查找时忽略大小写、中划线和下划线。
     */
    private Map<String, Map<String, Object>> sections = new LinkedHashMap<>();

    @Data
    public static class Supervisor {

        /**
         * 巡检周期
         */
        private Duration pollPeriod = Duration.ofSeconds(1);
    }
}
