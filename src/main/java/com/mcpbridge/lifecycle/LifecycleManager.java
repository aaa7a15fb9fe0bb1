package com.mcpbridge.lifecycle;

import com.mcpbridge.config.ServerCatalog;
import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.InstanceFilter;
import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ServerDefinition;
import com.mcpbridge.monitoring.InstanceMetricsRecorder;
import com.mcpbridge.monitoring.InstanceSummary;
import com.mcpbridge.monitoring.ResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for instance lifecycle operations.
 * <p>
 * Dispatches each request to the scoped manager matching the definition's lifecycle mode
 * and owns the background cleanup and monitoring timers.
 */
public class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final Map<LifecycleMode, InstanceManager> managers = new EnumMap<>(LifecycleMode.class);
    private final InstanceCleanupSweeper sweeper;
    private final ResourceMonitor monitor;
    private final InstanceMetricsRecorder recorder;
    private final ServerCatalog catalog;

    public LifecycleManager(List<InstanceManager> managers, InstanceCleanupSweeper sweeper, ResourceMonitor monitor,
                            InstanceMetricsRecorder recorder, ServerCatalog catalog) {
        for (InstanceManager manager : managers) {
            this.managers.put(manager.mode(), manager);
        }
        for (LifecycleMode mode : LifecycleMode.values()) {
            if (!this.managers.containsKey(mode)) {
                throw new IllegalArgumentException("No instance manager registered for mode " + mode.value());
            }
        }
        this.sweeper = sweeper;
        this.monitor = monitor;
        this.recorder = recorder;
        this.catalog = catalog;
    }

    public InstanceManager getManager(LifecycleMode mode) {
        return managers.get(mode);
    }

    /**
     * Returns the running instance for the caller's identity, creating one on a miss.
     * Completes exceptionally with a {@link LifecycleException}.
     */
    public CompletableFuture<Instance> getOrCreateInstance(ServerDefinition definition, CallerContext context) {
        InstanceManager manager = managers.get(definition.lifecycle());
        InstanceKey key;
        try {
            key = manager.keyFor(definition, context);
        } catch (AdmissionException e) {
            // createInstance reports the refusal
            return manager.createInstance(definition, context);
        }

        Optional<Instance> existing = manager.getInstance(key, context.userId());
        if (existing.isPresent()) {
            return CompletableFuture.completedFuture(existing.get());
        }
        return manager.createInstance(definition, context);
    }

    /**
     * Resolves the definition by name from the server catalog.
     */
    public CompletableFuture<Instance> getOrCreateInstance(String serverName, CallerContext context) {
        Optional<ServerDefinition> definition = catalog.find(serverName);
        if (definition.isEmpty()) {
            return CompletableFuture.failedFuture(new AdmissionException(AdmissionException.UNKNOWN_SERVER,
                    "Unknown server '" + serverName + "'"));
        }
        return getOrCreateInstance(definition.get(), context);
    }

    public CompletableFuture<Void> stopInstance(InstanceKey key) {
        return managers.get(key.mode()).stopInstance(key);
    }

    public List<Instance> listInstances(InstanceFilter filter) {
        if (filter != null && filter.mode() != null) {
            return managers.get(filter.mode()).listInstances(filter);
        }
        var all = new ArrayList<Instance>();
        for (InstanceManager manager : managers.values()) {
            all.addAll(manager.listInstances(filter));
        }
        return all;
    }

    public List<Instance> listActiveInstances() {
        return listInstances(InstanceFilter.any());
    }

    public Optional<Instance> findInstance(String instanceId) {
        return listActiveInstances().stream()
                .filter(i -> i.getId().equals(instanceId))
                .findFirst();
    }

    /**
     * Stops every user-scope and session-scope instance of a user.
     *
     * @return the number of instances stopped
     */
    public CompletableFuture<Integer> terminateUserInstances(String userId) {
        var targets = new ArrayList<InstanceKey>();
        for (LifecycleMode mode : List.of(LifecycleMode.USER, LifecycleMode.SESSION)) {
            managers.get(mode).listInstances(InstanceFilter.byUser(userId))
                    .forEach(i -> targets.add(i.getKey()));
        }
        log.info("Terminating {} instance(s) of user {}", targets.size(), userId);
        return stopAll(targets);
    }

    /**
     * Stops every session-scope instance bound to a session.
     *
     * @return the number of instances stopped
     */
    public CompletableFuture<Integer> terminateSessionInstances(String sessionId) {
        var targets = new ArrayList<InstanceKey>();
        managers.get(LifecycleMode.SESSION).listInstances(InstanceFilter.bySession(sessionId))
                .forEach(i -> targets.add(i.getKey()));
        log.info("Terminating {} instance(s) of session {}", targets.size(), sessionId);
        return stopAll(targets);
    }

    private CompletableFuture<Integer> stopAll(List<InstanceKey> keys) {
        List<CompletableFuture<Boolean>> stops = new ArrayList<>();
        for (InstanceKey key : keys) {
            stops.add(stopInstance(key).handle((v, e) -> {
                if (e != null) {
                    log.warn("Could not stop {}: {}", key, e.getMessage());
                    return false;
                }
                return true;
            }));
        }
        return CompletableFuture.allOf(stops.toArray(CompletableFuture[]::new))
                .thenApply(v -> (int) stops.stream().filter(CompletableFuture::join).count());
    }

    public InstanceSummary getAggregatedMetrics() {
        return recorder.getAggregatedMetrics();
    }

    public void recordAccess(String instanceId, String userId) {
        recorder.recordAccess(instanceId, userId);
    }

    public void recordResourceUsage(String instanceId, double memoryMb, double cpuPercent) {
        recorder.recordResourceUsage(instanceId, memoryMb, cpuPercent);
    }

    /**
     * Adds a completed tool call to the instance's rolling statistics.
     *
     * @return false if no pooled instance has that id
     */
    public boolean recordRequest(String instanceId, Duration responseTime, boolean failed) {
        Optional<Instance> instance = findInstance(instanceId);
        instance.ifPresent(i -> {
            i.getStats().recordResponseTime(responseTime.toMillis());
            if (failed) {
                i.getStats().recordError();
            }
        });
        return instance.isPresent();
    }

    public Map<LifecycleMode, Integer> getInstanceCounts() {
        var counts = new EnumMap<LifecycleMode, Integer>(LifecycleMode.class);
        managers.forEach((mode, manager) -> counts.put(mode, manager.getInstanceCount()));
        return counts;
    }

    public int getRunningInstanceCount() {
        return managers.values().stream().mapToInt(InstanceManager::getRunningInstanceCount).sum();
    }

    public CompletableFuture<Integer> runCleanup() {
        return sweeper.sweep();
    }

    public void startCleanupTask() {
        sweeper.start();
    }

    public void stopCleanupTask() {
        sweeper.stop();
    }

    public void startMonitoring() {
        monitor.start();
    }

    public void stopMonitoring() {
        monitor.stop();
    }

    /**
     * Halts both timers and stops every instance, waiting a bounded time for termination.
     */
    public void shutdown() {
        log.info("Shutting down lifecycle manager");
        stopCleanupTask();
        stopMonitoring();

        List<CompletableFuture<Void>> shutdowns = new ArrayList<>();
        for (InstanceManager manager : managers.values()) {
            shutdowns.add(manager.shutdown());
        }
        try {
            CompletableFuture.allOf(shutdowns.toArray(CompletableFuture[]::new))
                    .get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping instances");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Not every instance stopped cleanly: {}", e.getMessage());
        }
        monitor.close();
    }
}
