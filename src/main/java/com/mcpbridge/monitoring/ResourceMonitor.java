package com.mcpbridge.monitoring;

import com.mcpbridge.core.events.EventBus;
import com.mcpbridge.core.events.LifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically samples CPU and resident memory of started instances and records them
 * through the {@link InstanceMetricsRecorder}.
 * <p>
 * Processes are tracked by pid only. Registration follows the {@code instance.started}
 * signal, removal follows {@code instance.stopped} and {@code instance.crashed}.
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final InstanceMetricsRecorder recorder;
    private final Duration interval;
    private final Map<String, Tracked> processes = new ConcurrentHashMap<>();
    private final EventBus.Subscription subscription;

    private ScheduledExecutorService scheduler;

    public ResourceMonitor(InstanceMetricsRecorder recorder, EventBus eventBus, Duration interval) {
        this.recorder = recorder;
        this.interval = interval;
        this.subscription = eventBus.subscribeTo(List.of(LifecycleEvent.INSTANCE_STARTED,
                LifecycleEvent.INSTANCE_STOPPED, LifecycleEvent.INSTANCE_CRASHED), this::onEvent);
    }

    private void onEvent(LifecycleEvent event) {
        switch (event.eventType()) {
            case LifecycleEvent.INSTANCE_STARTED -> {
                Object pid = event.payload() != null ? event.payload().get("pid") : null;
                if (pid instanceof Number n) {
                    addProcess(event.instanceId(), n.longValue());
                }
            }
            case LifecycleEvent.INSTANCE_STOPPED, LifecycleEvent.INSTANCE_CRASHED -> removeProcess(event.instanceId());
            default -> { }
        }
    }

    public void addProcess(String instanceId, long pid) {
        processes.put(instanceId, new Tracked(pid));
        log.debug("Monitoring instance {} (pid {})", instanceId, pid);
    }

    public void removeProcess(String instanceId) {
        processes.remove(instanceId);
    }

    public int trackedCount() {
        return processes.size();
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "resource-monitor");
            t.setDaemon(true);
            return t;
        });
        long ms = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::poll, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Resource monitoring started (every {})", interval);
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Resource monitoring stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /** Unsubscribes from the event bus and halts sampling. */
    public void close() {
        stop();
        subscription.unsubscribe();
    }

    void poll() {
        for (var entry : processes.entrySet()) {
            String instanceId = entry.getKey();
            Tracked tracked = entry.getValue();
            try {
                Optional<ProcessHandle> handle = ProcessHandle.of(tracked.pid);
                if (handle.isEmpty() || !handle.get().isAlive()) {
                    processes.remove(instanceId);
                    continue;
                }
                double cpu = tracked.cpuPercent(handle.get());
                OptionalDouble memoryMb = readResidentMemoryMb(tracked.pid);
                if (memoryMb.isPresent()) {
                    recorder.recordResourceUsage(instanceId, memoryMb.getAsDouble(), cpu);
                }
            } catch (Exception e) {
                log.warn("Failed to sample instance {} (pid {}): {}", instanceId, tracked.pid, e.getMessage());
            }
        }
    }

    static OptionalDouble readResidentMemoryMb(long pid) {
        Path status = Path.of("/proc", Long.toString(pid), "status");
        if (!Files.isReadable(status)) {
            return OptionalDouble.empty();
        }
        try {
            for (String line : Files.readAllLines(status)) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring(6).trim().split("\\s+");
                    long kb = Long.parseLong(parts[0]);
                    return OptionalDouble.of(Math.round(kb / 1024.0));
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Cannot read memory of pid {}: {}", pid, e.getMessage());
        }
        return OptionalDouble.empty();
    }

    /** CPU bookkeeping for one pid: the previous sample's CPU time and wall clock. */
    private static final class Tracked {
        private final long pid;
        private long lastCpuNanos = -1;
        private long lastWallNanos;

        private Tracked(long pid) {
            this.pid = pid;
        }

        synchronized double cpuPercent(ProcessHandle handle) {
            long cpuNanos = handle.info().totalCpuDuration().map(Duration::toNanos).orElse(0L);
            long wallNanos = System.nanoTime();
            double percent = 0;
            if (lastCpuNanos >= 0 && wallNanos > lastWallNanos) {
                percent = (cpuNanos - lastCpuNanos) * 100.0 / (wallNanos - lastWallNanos);
            }
            lastCpuNanos = cpuNanos;
            lastWallNanos = wallNanos;
            return Math.max(0, percent);
        }
    }
}
