package com.mcpbridge.lifecycle;

import java.time.Duration;

/**
 * Thrown when an instance does not reach {@code RUNNING} within its startup timeout.
 * The process has already been killed when this surfaces.
 */
public class StartupTimeoutException extends LifecycleException {

    public StartupTimeoutException(String serverName, Duration timeout) {
        super(ErrorKind.TIMEOUT, "Server '" + serverName + "' did not become ready within " + timeout);
    }
}
