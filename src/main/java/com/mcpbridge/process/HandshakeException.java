package com.mcpbridge.process;

/**
 * Thrown when a spawned process does not complete the protocol handshake.
 */
public class HandshakeException extends RuntimeException {

    public HandshakeException(String message) {
        super(message);
    }

    public HandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
