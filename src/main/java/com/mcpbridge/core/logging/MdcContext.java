package com.mcpbridge.core.logging;

import com.mcpbridge.core.model.InstanceKey;
import org.slf4j.MDC;

/**
 * Utility for managing bridge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setInstance(InstanceKey key, String instanceId) {
        MDC.put("serverName", key.serverName());
        MDC.put("lifecycleMode", key.mode().value());
        if (key.userId() != null) MDC.put("userId", key.userId());
        if (key.sessionId() != null) MDC.put("sessionId", key.sessionId());
        if (instanceId != null) MDC.put("instanceId", instanceId);
    }

    public static void setInstanceId(String instanceId) {
        MDC.put("instanceId", instanceId);
    }

    public static void clear() {
        MDC.remove("serverName");
        MDC.remove("lifecycleMode");
        MDC.remove("userId");
        MDC.remove("sessionId");
        MDC.remove("instanceId");
    }
}
