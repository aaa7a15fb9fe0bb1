package com.mcpbridge.core.model;

/**
 * Status of a backend instance.
 * <p>
 * Happy path: {@code STARTING -> RUNNING -> STOPPING -> STOPPED}.
 * {@code ERROR}, {@code CRASHED}, {@code TIMEOUT} and {@code STOPPED} are terminal:
 * recovery always means a new instance object.
 */
public enum InstanceStatus {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR,
    CRASHED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR || this == CRASHED || this == TIMEOUT;
    }

    /** Terminal states reached through a failure rather than an orderly stop. */
    public boolean isFailure() {
        return this == ERROR || this == CRASHED || this == TIMEOUT;
    }
}
