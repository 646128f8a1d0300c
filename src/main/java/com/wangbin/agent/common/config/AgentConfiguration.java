package com.wangbin.agent.common.config;

import com.wangbin.agent.common.constant.AgentConstant;
import com.wangbin.agent.core.config.AgentProperties;
import com.wangbin.agent.core.config.GlobalOptions;
import com.wangbin.agent.core.job.JobResolver;
import com.wangbin.agent.core.job.JobTable;
import com.wangbin.agent.core.plugin.PluginDefinition;
import com.wangbin.agent.core.plugin.PluginRegistry;
import com.wangbin.agent.core.queue.ItemQueue;
import com.wangbin.agent.core.statistics.JobStatistics;
import com.wangbin.agent.core.supervisor.JobSupervisor;
import com.wangbin.agent.core.worker.Sleeper;
import com.wangbin.agent.core.worker.WorkerRegistry;
import com.wangbin.agent.plugins.stats.StatsCollector;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.stream.Collectors;

/**
 * Agent核心组件装配
 * 配置错误在上下文刷新阶段抛出 ConfigurationException，启动中止。
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfiguration {

    @Bean
    public GlobalOptions globalOptions(AgentProperties properties) {
        return GlobalOptions.from(properties.getSections());
    }

    @Bean
    public ItemQueue itemQueue(GlobalOptions globalOptions) {
        return new ItemQueue(AgentConstant.QUEUE_ITEMS, globalOptions.getMaxQueueLength());
    }

    @Bean
    public ItemQueue statsQueue(GlobalOptions globalOptions) {
        return new ItemQueue(AgentConstant.QUEUE_STATS, globalOptions.getMaxQueueLength());
    }

    @Bean
    public JobStatistics jobStatistics() {
        return new JobStatistics();
    }

    @Bean
    public WorkerRegistry workerRegistry() {
        return new WorkerRegistry();
    }

    /**
     * 内置自监控插件
     */
    @Bean
    public PluginDefinition agentStatsPlugin(JobStatistics jobStatistics) {
        return PluginDefinition.of(AgentConstant.MODULE_AGENT_STATS, context -> new StatsCollector(
                context.getOptions(), context.getQueue(), context.getStatsQueue(), context.getLogger(), jobStatistics));
    }

    @Bean
    public PluginRegistry pluginRegistry(ObjectProvider<PluginDefinition> definitions) {
        return new PluginRegistry(definitions.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public JobTable jobTable(AgentProperties properties,
                             PluginRegistry pluginRegistry,
                             @Qualifier("itemQueue") ItemQueue itemQueue,
                             @Qualifier("statsQueue") ItemQueue statsQueue) {
        return new JobResolver(pluginRegistry, itemQueue, statsQueue).resolve(properties.getSections());
    }

    @Bean(destroyMethod = "stop")
    public JobSupervisor jobSupervisor(JobTable jobTable,
                                       WorkerRegistry workerRegistry,
                                       JobStatistics jobStatistics,
                                       @Qualifier("workerThreadFactory") ThreadFactory workerThreadFactory,
                                       @Qualifier("supervisorScheduler") ScheduledExecutorService supervisorScheduler,
                                       AgentProperties properties) {
        return new JobSupervisor(jobTable, workerRegistry, jobStatistics, workerThreadFactory,
                supervisorScheduler, properties.getSupervisor().getPollPeriod(), Sleeper.SYSTEM);
    }
}
