package com.mcpbridge.lifecycle;

/**
 * Failure of one manager's cleanup pass. Reported through the {@code cleanup.error} signal,
 * never propagated out of a sweep.
 */
public class CleanupException extends LifecycleException {

    public CleanupException(String message, Throwable cause) {
        super(ErrorKind.CLEANUP, message, cause);
    }
}
