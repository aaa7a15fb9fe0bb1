package com.mcpbridge.core.model;

/**
 * Narrows instance listings by any subset of identity fields. {@code null} fields match everything.
 */
public record InstanceFilter(
    LifecycleMode mode,
    String serverName,
    String userId,
    String sessionId
) {

    private static final InstanceFilter ANY = new InstanceFilter(null, null, null, null);

    public static InstanceFilter any() {
        return ANY;
    }

    public static InstanceFilter byServer(String serverName) {
        return new InstanceFilter(null, serverName, null, null);
    }

    public static InstanceFilter byUser(String userId) {
        return new InstanceFilter(null, null, userId, null);
    }

    public static InstanceFilter bySession(String sessionId) {
        return new InstanceFilter(null, null, null, sessionId);
    }

    public boolean matches(InstanceKey key) {
        return (mode == null || mode == key.mode())
                && (serverName == null || serverName.equals(key.serverName()))
                && (userId == null || userId.equals(key.userId()))
                && (sessionId == null || sessionId.equals(key.sessionId()));
    }
}
