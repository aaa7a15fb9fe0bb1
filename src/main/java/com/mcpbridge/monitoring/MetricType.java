package com.mcpbridge.monitoring;

/**
 * Kind of sample held by the {@link InstanceMetricsRecorder}.
 */
public enum MetricType {
    /** One successful lookup; value is always 1. */
    ACCESS,
    /** Resident memory in MB. */
    MEMORY,
    /** CPU usage as a percentage. */
    CPU
}
