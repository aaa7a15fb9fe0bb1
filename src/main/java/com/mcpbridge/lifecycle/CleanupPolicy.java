package com.mcpbridge.lifecycle;

import java.time.Duration;

/**
 * Reclamation rules applied by one scoped manager.
 *
 * @param idleTimeout  instances unused for longer are removed
 * @param maxAge       absolute lifetime cap regardless of use
 * @param interval     sweep frequency
 * @param forcedGrace  how long a stopping instance may take before it is killed
 */
public record CleanupPolicy(
    Duration idleTimeout,
    Duration maxAge,
    Duration interval,
    Duration forcedGrace
) {}
