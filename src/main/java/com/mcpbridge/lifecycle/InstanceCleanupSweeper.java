package com.mcpbridge.lifecycle;

import com.mcpbridge.core.events.EventBus;
import com.mcpbridge.core.events.LifecycleEvent;
import com.mcpbridge.core.metrics.BridgeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically runs {@link InstanceManager#cleanup()} on every registered manager.
 * <p>
 * Managers are swept concurrently. A manager that fails is reported through
 * {@code cleanup.error} and counts 0 for the tick; the others are unaffected.
 * The sweeper holds no instance state of its own.
 */
public class InstanceCleanupSweeper {

    private static final Logger log = LoggerFactory.getLogger(InstanceCleanupSweeper.class);

    private final List<InstanceManager> managers;
    private final EventBus eventBus;
    private final BridgeMetrics metrics;
    private final Duration interval;
    private final boolean skipOverlappingTicks;
    private final AtomicBoolean sweeping = new AtomicBoolean();

    private ScheduledExecutorService scheduler;

    public InstanceCleanupSweeper(List<InstanceManager> managers, EventBus eventBus, BridgeMetrics metrics,
                                  Duration interval, boolean skipOverlappingTicks) {
        this.managers = List.copyOf(managers);
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.interval = interval;
        this.skipOverlappingTicks = skipOverlappingTicks;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "instance-cleanup");
            t.setDaemon(true);
            return t;
        });
        long ms = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweep, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Instance cleanup scheduled every {}", interval);
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Instance cleanup stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * Runs one sweep over all managers.
     *
     * @return the total number of instances removed, or 0 when skipped because a previous
     *         sweep is still running
     */
    public CompletableFuture<Integer> sweep() {
        if (!sweeping.compareAndSet(false, true) && skipOverlappingTicks) {
            log.info("Previous cleanup still running, skipping this tick");
            return CompletableFuture.completedFuture(0);
        }
        sweeping.set(true);
        eventBus.publish(LifecycleEvent.of(LifecycleEvent.CLEANUP_STARTED, null, null,
                Map.of("managers", managers.size())));

        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (InstanceManager manager : managers) {
            results.add(cleanupSafely(manager));
        }

        return CompletableFuture.allOf(results.toArray(CompletableFuture[]::new))
                .thenApply(v -> {
                    int removed = results.stream().mapToInt(CompletableFuture::join).sum();
                    metrics.recordCleanupRemoved(removed);
                    eventBus.publish(LifecycleEvent.of(LifecycleEvent.CLEANUP_COMPLETED, null, null,
                            Map.of("removed", removed)));
                    if (removed > 0) {
                        log.info("Cleanup removed {} instance(s)", removed);
                    }
                    return removed;
                })
                .whenComplete((r, e) -> sweeping.set(false));
    }

    private CompletableFuture<Integer> cleanupSafely(InstanceManager manager) {
        CompletableFuture<Integer> cleanup;
        try {
            cleanup = manager.cleanup();
        } catch (RuntimeException e) {
            cleanup = CompletableFuture.failedFuture(e);
        }
        return cleanup.exceptionally(e -> {
            var error = new CleanupException("Cleanup of " + manager.mode().value() + " instances failed", e);
            log.error("{}: {}", error.getMessage(), e.getMessage(), e);
            eventBus.publish(LifecycleEvent.of(LifecycleEvent.CLEANUP_ERROR, null, null,
                    Map.of("mode", manager.mode().value(), "error", String.valueOf(e.getMessage()))));
            return 0;
        });
    }
}
