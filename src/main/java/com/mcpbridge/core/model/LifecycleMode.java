package com.mcpbridge.core.model;

import java.util.Locale;

/**
 * Scope at which a backend instance is shared.
 */
public enum LifecycleMode {
    GLOBAL("global"),
    USER("user"),
    SESSION("session");

    private final String value;

    LifecycleMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static LifecycleMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Lifecycle mode must not be blank");
        }
        return LifecycleMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
