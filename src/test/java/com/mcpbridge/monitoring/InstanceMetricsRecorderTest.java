package com.mcpbridge.monitoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InstanceMetricsRecorderTest {

    private InstanceMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new InstanceMetricsRecorder(Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("empty recorder aggregates to zeros")
    void emptyAggregate() {
        var summary = recorder.getAggregatedMetrics();

        assertEquals(0, summary.totalInstances());
        assertEquals(0, summary.totalAccesses());
        assertEquals(0, summary.activeUsers());
        assertEquals(0.0, summary.averageMemoryUsage());
        assertEquals(0.0, summary.averageCpuUsage());
    }

    @Test
    @DisplayName("aggregates accesses, distinct users and resource averages")
    void aggregates() {
        recorder.recordAccess("i-1", "alice");
        recorder.recordAccess("i-1", "alice");
        recorder.recordAccess("i-2", "bob");
        recorder.recordAccess("i-3", null);
        recorder.recordResourceUsage("i-1", 100, 10);
        recorder.recordResourceUsage("i-2", 300, 30);

        var summary = recorder.getAggregatedMetrics();

        assertEquals(3, summary.totalInstances());
        assertEquals(4, summary.totalAccesses());
        assertEquals(2, summary.activeUsers());
        assertEquals(200.0, summary.averageMemoryUsage(), 0.001);
        assertEquals(20.0, summary.averageCpuUsage(), 0.001);
    }

    @Test
    @DisplayName("returns samples oldest first with the clock's timestamp")
    void instanceSeries() {
        recorder.recordAccess("i-1", "alice");
        recorder.recordResourceUsage("i-1", 64, 2.5);

        var series = recorder.getInstanceMetrics("i-1");

        assertEquals(3, series.size());
        assertEquals(MetricType.ACCESS, series.get(0).type());
        assertEquals(MetricType.MEMORY, series.get(1).type());
        assertEquals(64.0, series.get(1).value());
        assertEquals(MetricType.CPU, series.get(2).type());
        assertEquals(Instant.parse("2026-01-15T10:00:00Z"), series.get(2).timestamp());
        assertTrue(recorder.getInstanceMetrics("unknown").isEmpty());
    }

    @Test
    @DisplayName("series are bounded and drop the oldest samples in a batch")
    void boundedSeries() {
        for (int i = 0; i < InstanceMetricsRecorder.MAX_SAMPLES + 50; i++) {
            recorder.recordResourceUsage("i-1", i, 0);
        }

        var series = recorder.getInstanceMetrics("i-1");

        assertTrue(series.size() <= InstanceMetricsRecorder.MAX_SAMPLES);
        assertTrue(series.size() > InstanceMetricsRecorder.MAX_SAMPLES - InstanceMetricsRecorder.TRIM_BATCH);
        assertTrue(series.get(0).value() > 0, "oldest samples should have been dropped");
        assertEquals(InstanceMetricsRecorder.MAX_SAMPLES + 49.0, series.get(series.size() - 2).value());
    }

    @Test
    @DisplayName("returned series is a snapshot")
    void snapshot() {
        recorder.recordAccess("i-1", "alice");
        var series = recorder.getInstanceMetrics("i-1");

        recorder.recordAccess("i-1", "alice");

        assertEquals(1, series.size());
        assertThrows(UnsupportedOperationException.class, series::clear);
    }

    @Test
    @DisplayName("removing an instance drops its series from the aggregate")
    void removeInstance() {
        recorder.recordAccess("i-1", "alice");
        recorder.recordResourceUsage("i-1", 100, 10);
        recorder.recordAccess("i-2", "bob");

        recorder.removeInstance("i-1");
        recorder.removeInstance("unknown");

        var summary = recorder.getAggregatedMetrics();
        assertTrue(recorder.getInstanceMetrics("i-1").isEmpty());
        assertEquals(1, summary.totalInstances());
        assertEquals(1, summary.totalAccesses());
        assertEquals(1, summary.activeUsers());
        assertEquals(0.0, summary.averageMemoryUsage());
    }
}
