package com.mcpbridge.monitoring;

import com.mcpbridge.core.events.EventBus;
import com.mcpbridge.core.events.LifecycleEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ResourceMonitorTest {

    private EventBus eventBus;
    private InstanceMetricsRecorder recorder;
    private ResourceMonitor monitor;
    private Process child;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        recorder = new InstanceMetricsRecorder();
        monitor = new ResourceMonitor(recorder, eventBus, Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        if (child != null) {
            child.destroyForcibly();
        }
    }

    @Test
    @DisplayName("tracks processes on instance.started and forgets them on stop or crash")
    void followsLifecycleEvents() {
        eventBus.publish(LifecycleEvent.of(LifecycleEvent.INSTANCE_STARTED, "files", "i-1", Map.of("pid", 1234L)));
        eventBus.publish(LifecycleEvent.of(LifecycleEvent.INSTANCE_STARTED, "files", "i-2", Map.of("pid", 1235)));
        assertEquals(2, monitor.trackedCount());

        eventBus.publish(LifecycleEvent.of(LifecycleEvent.INSTANCE_STOPPED, "files", "i-1", Map.of()));
        eventBus.publish(LifecycleEvent.of(LifecycleEvent.INSTANCE_CRASHED, "files", "i-2", Map.of()));
        assertEquals(0, monitor.trackedCount());
    }

    @Test
    @DisplayName("ignores started events without a pid")
    void ignoresMissingPid() {
        eventBus.publish(LifecycleEvent.of(LifecycleEvent.INSTANCE_STARTED, "files", "i-1", Map.of()));

        assertEquals(0, monitor.trackedCount());
    }

    @Test
    @DisplayName("close unsubscribes from the event bus")
    void closeUnsubscribes() {
        monitor.close();

        eventBus.publish(LifecycleEvent.of(LifecycleEvent.INSTANCE_STARTED, "files", "i-1", Map.of("pid", 1234L)));

        assertEquals(0, monitor.trackedCount());
    }

    @Test
    @DisplayName("poll records memory and CPU of a live process")
    void pollsLiveProcess() throws Exception {
        assumeTrue(Files.isDirectory(Path.of("/proc/self")), "requires procfs");
        child = new ProcessBuilder("sleep", "30").start();
        monitor.addProcess("i-1", child.pid());

        monitor.poll();

        var series = recorder.getInstanceMetrics("i-1");
        assertEquals(2, series.size());
        assertEquals(MetricType.MEMORY, series.get(0).type());
        assertTrue(series.get(0).value() >= 0);
        assertEquals(MetricType.CPU, series.get(1).type());
        assertEquals(0.0, series.get(1).value(), "first sample has no CPU delta");
    }

    @Test
    @DisplayName("poll drops processes that have exited")
    void pollDropsDeadProcess() throws Exception {
        child = new ProcessBuilder("true").start();
        child.waitFor();
        monitor.addProcess("i-1", child.pid());

        monitor.poll();

        assertEquals(0, monitor.trackedCount());
        assertTrue(recorder.getInstanceMetrics("i-1").isEmpty());
    }

    @Test
    @DisplayName("start and stop are idempotent")
    void startStopIdempotent() {
        monitor.start();
        monitor.start();
        assertTrue(monitor.isRunning());

        monitor.stop();
        monitor.stop();
        assertFalse(monitor.isRunning());
    }

    @Test
    @DisplayName("memory of an unknown pid is absent")
    void unknownPidMemory() {
        assertTrue(ResourceMonitor.readResidentMemoryMb(Long.MAX_VALUE).isEmpty());
    }
}
