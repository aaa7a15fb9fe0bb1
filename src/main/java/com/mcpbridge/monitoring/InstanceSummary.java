package com.mcpbridge.monitoring;

/**
 * Aggregate view over every instance tracked by the {@link InstanceMetricsRecorder}.
 *
 * @param totalInstances     number of instances with at least one sample
 * @param totalAccesses      number of access samples retained
 * @param activeUsers        distinct user ids seen on access samples
 * @param averageMemoryUsage mean of all memory samples in MB, 0 when none
 * @param averageCpuUsage    mean of all CPU samples in percent, 0 when none
 */
public record InstanceSummary(
    int totalInstances,
    long totalAccesses,
    int activeUsers,
    double averageMemoryUsage,
    double averageCpuUsage
) {}
