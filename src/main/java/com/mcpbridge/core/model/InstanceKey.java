package com.mcpbridge.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Deduplication key of a poolable instance. Two live instances never share a key.
 * <p>
 * Global keys carry neither user nor session, user keys carry the user only,
 * session keys carry both.
 */
public record InstanceKey(
    String serverName,
    LifecycleMode mode,
    String userId,
    String sessionId
) implements Serializable {

    public InstanceKey {
        Objects.requireNonNull(serverName, "serverName");
        Objects.requireNonNull(mode, "mode");
    }

    public static InstanceKey global(String serverName) {
        return new InstanceKey(serverName, LifecycleMode.GLOBAL, null, null);
    }

    public static InstanceKey user(String serverName, String userId) {
        return new InstanceKey(serverName, LifecycleMode.USER, userId, null);
    }

    public static InstanceKey session(String serverName, String userId, String sessionId) {
        return new InstanceKey(serverName, LifecycleMode.SESSION, userId, sessionId);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(mode.value()).append(':').append(serverName);
        if (userId != null) sb.append('/').append(userId);
        if (sessionId != null) sb.append('/').append(sessionId);
        return sb.toString();
    }
}
