package com.wangbin.agent.core.job;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.wangbin.agent.common.domain.item.Item;
import com.wangbin.agent.common.exception.ConfigurationException;
import com.wangbin.agent.core.config.GlobalOptions;
import com.wangbin.agent.core.config.SectionOptions;
import com.wangbin.agent.core.plugin.PluginRegistry;
import com.wangbin.agent.core.plugin.TestCollectors;
import com.wangbin.agent.core.queue.ItemQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobResolverTest {

    private ItemQueue queue;
    private PluginRegistry registry;
    private JobResolver resolver;

    @BeforeEach
    void setUp() {
        queue = new ItemQueue("items", 100);
        registry = new PluginRegistry();
        registry.register("metric", TestCollectors.MetricOnly.class);
        registry.register("all", TestCollectors.AllKinds.class);
        registry.register("discovery", TestCollectors.DiscoveryOnly.class);
        registry.register("none", TestCollectors.NoCapability.class);
        registry.register("failing", TestCollectors.FailingConstructor.class);
        resolver = new JobResolver(registry, queue, new ItemQueue("stats", 100));
    }

    @Test
    void oneJobPerCapabilityWithDerivedNames() {
        Map<String, Map<String, Object>> sections = sections(
                "memcached01", Map.of("module", "all"),
                "web01", Map.of("module", "metric"),
                "disk01", Map.of("module", "discovery"),
                "idle01", Map.of("module", "none"));

        JobTable table = resolver.resolve(sections);

        assertEquals(List.of(
                "memcached01-looped_method",
                "memcached01-build_items",
                "memcached01-build_discovery_items",
                "web01-build_items",
                "disk01-build_discovery_items"), List.copyOf(table.getNames()));

        JobDescriptor legacy = table.get("memcached01-looped_method");
        assertEquals(JobKind.LEGACY, legacy.getKind());
        assertEquals("memcached01", legacy.getSection());
        assertEquals("all", legacy.getModule());
        assertEquals(JobKind.DISCOVERY, table.get("disk01-build_discovery_items").getKind());
    }

    @Test
    void boundTasksInvokeTheCollectorCallbacks() throws Exception {
        JobTable table = resolver.resolve(sections("memcached01", Map.of("module", "all", "hostname", "node1")));

        table.get("memcached01-looped_method").getTask().execute();
        table.get("memcached01-build_items").getTask().execute();
        table.get("memcached01-build_discovery_items").getTask().execute();

        Item legacy = queue.take();
        Item metric = queue.take();
        Item discovery = queue.take();
        assertEquals("legacy", legacy.getKey());
        assertEquals("metric", metric.getKey());
        assertEquals("node1", metric.getHost());
        assertEquals("{\"data\": [{\"{#H}\": \"node1\"}]}", discovery.getData().get("value"));
    }

    @Test
    void sectionIntervalWinsOverGlobalAndDefault() {
        JobTable table = resolver.resolve(sections(
                "global", Map.of("max_queue_length", 10, "interval", 30, "lld_interval", 300),
                "memcached01", Map.of("module", "all", "interval", "5", "lld_interval", 50)));

        assertEquals(5.0, table.get("memcached01-looped_method").getIntervalSeconds());
        assertEquals(5.0, table.get("memcached01-build_items").getIntervalSeconds());
        assertEquals(50.0, table.get("memcached01-build_discovery_items").getIntervalSeconds());
    }

    @Test
    void globalIntervalAppliesWhenSectionHasNone() {
        JobTable table = resolver.resolve(sections(
                "global", Map.of("max_queue_length", 10, "interval", 30, "lld_interval", 300),
                "memcached01", Map.of("module", "all")));

        assertEquals(30.0, table.get("memcached01-looped_method").getIntervalSeconds());
        assertEquals(30.0, table.get("memcached01-build_items").getIntervalSeconds());
        assertEquals(300.0, table.get("memcached01-build_discovery_items").getIntervalSeconds());
    }

    @Test
    void kindDefaultsApplyWhenNothingConfigured() {
        JobTable table = resolver.resolve(sections("memcached01", Map.of("module", "all")));

        assertEquals(60.0, table.get("memcached01-looped_method").getIntervalSeconds());
        assertEquals(60.0, table.get("memcached01-build_items").getIntervalSeconds());
        assertEquals(600.0, table.get("memcached01-build_discovery_items").getIntervalSeconds());
        assertEquals(Duration.ofMinutes(10), table.get("memcached01-build_discovery_items").getInterval());
    }

    @Test
    void metricIntervalDoesNotLeakIntoDiscovery() {
        SectionOptions options = new SectionOptions("s", Map.of("interval", 7));
        GlobalOptions global = GlobalOptions.from(Map.of("global", Map.of("max_queue_length", 1)));

        assertEquals(7.0, JobResolver.resolveInterval(JobKind.METRIC, options, global));
        assertEquals(600.0, JobResolver.resolveInterval(JobKind.DISCOVERY, options, global));
    }

    @Test
    void fractionalIntervalsAreKept() {
        JobTable table = resolver.resolve(sections("web01", Map.of("module", "metric", "interval", "0.25")));

        assertEquals(Duration.ofMillis(250), table.get("web01-build_items").getInterval());
    }

    @Test
    void configurationErrorsAbortResolution() {
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(sections("web01", Map.of("interval", 10))));
        ConfigurationException unknown = assertThrows(ConfigurationException.class,
                () -> resolver.resolve(sections("web01", Map.of("module", "redis"))));
        assertEquals("web01", unknown.getSection());
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(sections("web01", Map.of("module", "failing"))));
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(sections("web01", Map.of("module", "metric", "interval", "-1"))));
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(Map.of("web01", Map.of("module", "metric"))));
    }

    @Test
    void duplicateJobNamesAreRejected() {
        JobDescriptor first = JobDescriptor.builder()
                .name("web01-build_items").section("web01").kind(JobKind.METRIC)
                .intervalSeconds(60).task(() -> { }).build();
        JobDescriptor second = JobDescriptor.builder()
                .name("web01-build_items").section("WEB01").kind(JobKind.METRIC)
                .intervalSeconds(30).task(() -> { }).build();

        JobTable.Builder builder = JobTable.builder().add(first);
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> builder.add(second));
        assertTrue(error.getMessage().contains("web01-build_items"));
        assertSame(first, builder.build().get("web01-build_items"));
    }

    @Test
    void deprecatedCallbackWarnsOncePerModule() {
        Logger logger = (Logger) LoggerFactory.getLogger(JobResolver.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            JobTable table = resolver.resolve(sections(
                    "memcached01", Map.of("module", "all"),
                    "memcached02", Map.of("module", "all")));

            assertTrue(table.contains("memcached01-looped_method"));
            assertTrue(table.contains("memcached02-looped_method"));
            List<ILoggingEvent> warnings = appender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .toList();
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).getFormattedMessage().contains("looped_method"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void jobTableIsReadOnly() {
        JobTable table = resolver.resolve(sections("web01", Map.of("module", "metric")));

        assertThrows(UnsupportedOperationException.class, () -> table.getNames().clear());
    }

    /**
     * 按参数顺序构造配置段，未给出 global 时补默认值
     */
    private static Map<String, Map<String, Object>> sections(Object... pairs) {
        Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
        sections.put("global", Map.of("max_queue_length", 100));
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            Map<String, Object> options = (Map<String, Object>) pairs[i + 1];
            sections.put((String) pairs[i], options);
        }
        return sections;
    }
}
