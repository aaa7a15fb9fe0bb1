package com.mcpbridge.lifecycle;

/**
 * Base of every classified failure raised by the instance lifecycle.
 */
public class LifecycleException extends RuntimeException {

    private final ErrorKind kind;

    public LifecycleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LifecycleException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
