package com.mcpbridge.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpbridge.config.ServerCatalog;
import com.mcpbridge.core.events.EventBus;
import com.mcpbridge.core.metrics.BridgeMetrics;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.template.PathTemplateResolver;
import com.mcpbridge.mcp.McpInitializeHandshake;
import com.mcpbridge.monitoring.InstanceMetricsRecorder;
import com.mcpbridge.monitoring.ResourceMonitor;
import com.mcpbridge.process.DefaultProcessLauncher;
import com.mcpbridge.process.ProcessLauncher;
import com.mcpbridge.process.ProtocolHandshake;
import com.mcpbridge.process.StreamReadyHandshake;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class LifecycleConfig {

    @Bean
    public PathTemplateResolver pathTemplateResolver(LifecycleProperties properties) {
        return new PathTemplateResolver(properties.getAllowedPathPrefixes());
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }

    @Bean
    @ConditionalOnProperty(name = "mcpbridge.lifecycle.handshake", havingValue = "streams", matchIfMissing = true)
    public ProtocolHandshake streamReadyHandshake() {
        return new StreamReadyHandshake();
    }

    @Bean
    @ConditionalOnProperty(name = "mcpbridge.lifecycle.handshake", havingValue = "mcp")
    public ProtocolHandshake mcpInitializeHandshake(ObjectProvider<ObjectMapper> objectMapper,
                                                    LifecycleProperties properties) {
        return new McpInitializeHandshake(objectMapper.getIfAvailable(ObjectMapper::new),
                properties.getClient().getName(), properties.getClient().getVersion());
    }

    /** Spawns, handshakes and stops block, so the pool grows on demand. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService lifecycleExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lifecycle-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ManagerSupport managerSupport(PathTemplateResolver resolver, InstanceMetricsRecorder recorder,
                                         ProcessLauncher launcher, ProtocolHandshake handshake,
                                         EventBus eventBus, BridgeMetrics metrics,
                                         ExecutorService lifecycleExecutor, LifecycleProperties properties) {
        return new ManagerSupport(resolver, recorder, launcher, handshake, eventBus, metrics,
                lifecycleExecutor, Clock.systemUTC(), properties.getStartupTimeout(),
                properties.getMaxInstancesPerManager());
    }

    @Bean
    public UserLimitsRegistry userLimitsRegistry(LifecycleProperties properties) {
        return new UserLimitsRegistry(properties.defaultUserLimits());
    }

    @Bean
    public GlobalInstanceManager globalInstanceManager(ManagerSupport support, LifecycleProperties properties) {
        return new GlobalInstanceManager(support, properties.cleanupPolicyFor(LifecycleMode.GLOBAL));
    }

    @Bean
    public UserInstanceManager userInstanceManager(ManagerSupport support, LifecycleProperties properties,
                                                   UserLimitsRegistry limits) {
        return new UserInstanceManager(support, properties.cleanupPolicyFor(LifecycleMode.USER), limits);
    }

    @Bean
    public SessionInstanceManager sessionInstanceManager(ManagerSupport support, LifecycleProperties properties,
                                                         UserLimitsRegistry limits) {
        return new SessionInstanceManager(support, properties.cleanupPolicyFor(LifecycleMode.SESSION), limits);
    }

    @Bean
    public InstanceCleanupSweeper instanceCleanupSweeper(List<InstanceManager> managers, EventBus eventBus,
                                                         BridgeMetrics metrics, LifecycleProperties properties) {
        var cleanup = properties.getCleanup();
        return new InstanceCleanupSweeper(managers, eventBus, metrics,
                cleanup.getInterval(), cleanup.isSkipOverlappingTicks());
    }

    @Bean
    public ResourceMonitor resourceMonitor(InstanceMetricsRecorder recorder, EventBus eventBus,
                                           LifecycleProperties properties) {
        return new ResourceMonitor(recorder, eventBus, properties.getMonitoring().getInterval());
    }

    @Bean(destroyMethod = "shutdown")
    public LifecycleManager lifecycleManager(List<InstanceManager> managers, InstanceCleanupSweeper sweeper,
                                             ResourceMonitor monitor, InstanceMetricsRecorder recorder,
                                             ServerCatalog catalog, LifecycleProperties properties) {
        var manager = new LifecycleManager(managers, sweeper, monitor, recorder, catalog);
        if (properties.getCleanup().isEnabled()) {
            manager.startCleanupTask();
        }
        if (properties.getMonitoring().isEnabled()) {
            manager.startMonitoring();
        }
        return manager;
    }
}
