package com.mcpbridge.core.model;

import java.io.Serializable;

/**
 * Optional resource ceilings for a server definition. Any component may be {@code null}.
 *
 * @param maxMemoryMb    advisory memory ceiling in MB
 * @param maxCpuPercent  advisory CPU ceiling as a percentage
 * @param timeoutMinutes startup timeout; falls back to the configured default when absent
 * @param maxInstances   admission ceiling for this server within one manager
 */
public record ResourceLimits(
    Integer maxMemoryMb,
    Integer maxCpuPercent,
    Integer timeoutMinutes,
    Integer maxInstances
) implements Serializable {

    private static final ResourceLimits NONE = new ResourceLimits(null, null, null, null);

    public static ResourceLimits none() {
        return NONE;
    }
}
