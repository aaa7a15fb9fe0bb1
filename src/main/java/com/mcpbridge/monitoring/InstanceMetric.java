package com.mcpbridge.monitoring;

import java.time.Instant;

/**
 * A single timestamped sample for one instance.
 *
 * @param instanceId the sampled instance
 * @param userId     the caller behind an access sample, nullable
 * @param type       sample kind
 * @param value      sample value (1 for access samples)
 * @param timestamp  when the sample was taken
 */
public record InstanceMetric(
    String instanceId,
    String userId,
    MetricType type,
    double value,
    Instant timestamp
) {}
