package com.mcpbridge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Identity of the caller behind one inbound request. Created fresh per call, never persisted.
 *
 * @param lifecycleMode requested lifecycle mode (informational, the definition decides)
 * @param userId        authenticated user id, nullable
 * @param userEmail     user email, nullable
 * @param sessionId     login session id, nullable
 * @param identity      authenticated-identity payload (claims), never null
 * @param permissions   granted permissions, never null
 * @param requestId     request identifier
 * @param timestamp     when the request arrived
 */
public record CallerContext(
    LifecycleMode lifecycleMode,
    String userId,
    String userEmail,
    String sessionId,
    Map<String, Object> identity,
    Set<String> permissions,
    String requestId,
    Instant timestamp
) implements Serializable {

    public CallerContext {
        identity = identity != null ? presentClaims(identity) : Map.of();
        permissions = permissions != null ? presentPermissions(permissions) : Set.of();
        requestId = requestId != null ? requestId : UUID.randomUUID().toString();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static CallerContext anonymous() {
        return new CallerContext(LifecycleMode.GLOBAL, null, null, null, null, null, null, null);
    }

    public static CallerContext forUser(String userId, String userEmail) {
        return new CallerContext(LifecycleMode.USER, userId, userEmail, null, null, null, null, null);
    }

    public static CallerContext forSession(String userId, String sessionId) {
        return new CallerContext(LifecycleMode.SESSION, userId, null, sessionId, null, null, null, null);
    }

    /** Token payloads may carry null claims; those are dropped. */
    private static Map<String, Object> presentClaims(Map<String, Object> claims) {
        var present = new HashMap<String, Object>();
        claims.forEach((name, value) -> {
            if (name != null && value != null) {
                present.put(name, value);
            }
        });
        return Map.copyOf(present);
    }

    private static Set<String> presentPermissions(Set<String> permissions) {
        var present = new HashSet<String>(permissions);
        present.remove(null);
        return Set.copyOf(present);
    }

    public boolean hasUser() {
        return userId != null && !userId.isBlank();
    }

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
