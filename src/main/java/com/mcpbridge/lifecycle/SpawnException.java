package com.mcpbridge.lifecycle;

/**
 * Thrown when a child process cannot be started, when the privilege drop fails, or when
 * the protocol handshake is refused.
 */
public class SpawnException extends LifecycleException {

    public SpawnException(String message) {
        super(ErrorKind.SPAWN, message);
    }

    public SpawnException(String message, Throwable cause) {
        super(ErrorKind.SPAWN, message, cause);
    }
}
