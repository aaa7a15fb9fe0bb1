package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.LifecycleMode;

import java.util.Set;

/**
 * Per-user admission limits enforced by the user and session managers.
 *
 * @param maxInstances  live instances one user may hold within a manager
 * @param allowedModes  lifecycle modes the user may create instances for
 * @param maxMemoryMb   memory quota; definitions asking for more are refused
 * @param maxCpuPercent CPU quota, advisory
 * @param timeoutMinutes session timeout quota, advisory
 */
public record UserLimits(
    int maxInstances,
    Set<LifecycleMode> allowedModes,
    int maxMemoryMb,
    int maxCpuPercent,
    int timeoutMinutes
) {

    public UserLimits {
        allowedModes = allowedModes != null ? Set.copyOf(allowedModes) : Set.of();
    }
}
