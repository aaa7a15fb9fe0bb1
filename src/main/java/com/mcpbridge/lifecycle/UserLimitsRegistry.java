package com.mcpbridge.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default user limits plus per-user overrides.
 */
public class UserLimitsRegistry {

    private static final Logger log = LoggerFactory.getLogger(UserLimitsRegistry.class);

    private final UserLimits defaults;
    private final Map<String, UserLimits> overrides = new ConcurrentHashMap<>();

    public UserLimitsRegistry(UserLimits defaults) {
        this.defaults = defaults;
    }

    public UserLimits getUserLimits(String userId) {
        return overrides.getOrDefault(userId, defaults);
    }

    public void setUserLimits(String userId, UserLimits limits) {
        overrides.put(userId, limits);
        log.info("Updated limits for user {}: {}", userId, limits);
    }

    public void clearUserLimits(String userId) {
        overrides.remove(userId);
    }

    public UserLimits getDefaults() {
        return defaults;
    }
}
