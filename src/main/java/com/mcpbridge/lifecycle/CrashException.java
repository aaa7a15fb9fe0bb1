package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.InstanceKey;

/**
 * Raised to a caller whose identity holds a crashed instance that may no longer be restarted.
 */
public class CrashException extends LifecycleException {

    private final InstanceKey key;
    private final int retryCount;

    public CrashException(InstanceKey key, int retryCount, String message) {
        super(ErrorKind.CRASH, message);
        this.key = key;
        this.retryCount = retryCount;
    }

    public InstanceKey getKey() {
        return key;
    }

    public int getRetryCount() {
        return retryCount;
    }
}
