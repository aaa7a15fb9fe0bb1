package com.mcpbridge.monitoring;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded in-memory series of per-instance access, memory and CPU samples.
 * <p>
 * Each instance keeps at most {@value #MAX_SAMPLES} samples. When the limit is exceeded the
 * oldest {@value #TRIM_BATCH} are dropped in one batch.
 */
@Component
public class InstanceMetricsRecorder {

    static final int MAX_SAMPLES = 1000;
    static final int TRIM_BATCH = 100;

    private final Map<String, List<InstanceMetric>> samples = new LinkedHashMap<>();
    private final Clock clock;

    public InstanceMetricsRecorder() {
        this(Clock.systemUTC());
    }

    public InstanceMetricsRecorder(Clock clock) {
        this.clock = clock;
    }

    public void recordAccess(String instanceId, String userId) {
        add(new InstanceMetric(instanceId, userId, MetricType.ACCESS, 1, clock.instant()));
    }

    public void recordResourceUsage(String instanceId, double memoryMb, double cpuPercent) {
        var now = clock.instant();
        add(new InstanceMetric(instanceId, null, MetricType.MEMORY, memoryMb, now));
        add(new InstanceMetric(instanceId, null, MetricType.CPU, cpuPercent, now));
    }

    /**
     * Drops every sample of an instance that has left its pool.
     */
    public synchronized void removeInstance(String instanceId) {
        samples.remove(instanceId);
    }

    /**
     * @return a snapshot of the retained samples for one instance, oldest first
     */
    public synchronized List<InstanceMetric> getInstanceMetrics(String instanceId) {
        List<InstanceMetric> list = samples.get(instanceId);
        return list != null ? List.copyOf(list) : List.of();
    }

    public synchronized InstanceSummary getAggregatedMetrics() {
        long accesses = 0;
        Set<String> users = new HashSet<>();
        double memoryTotal = 0;
        int memoryCount = 0;
        double cpuTotal = 0;
        int cpuCount = 0;

        for (List<InstanceMetric> list : samples.values()) {
            for (InstanceMetric m : list) {
                switch (m.type()) {
                    case ACCESS -> {
                        accesses++;
                        if (m.userId() != null) users.add(m.userId());
                    }
                    case MEMORY -> {
                        memoryTotal += m.value();
                        memoryCount++;
                    }
                    case CPU -> {
                        cpuTotal += m.value();
                        cpuCount++;
                    }
                }
            }
        }

        return new InstanceSummary(
                samples.size(),
                accesses,
                users.size(),
                memoryCount == 0 ? 0 : memoryTotal / memoryCount,
                cpuCount == 0 ? 0 : cpuTotal / cpuCount);
    }

    private synchronized void add(InstanceMetric metric) {
        List<InstanceMetric> list = samples.computeIfAbsent(metric.instanceId(), k -> new ArrayList<>());
        list.add(metric);
        if (list.size() > MAX_SAMPLES) {
            list.subList(0, TRIM_BATCH).clear();
        }
    }
}
