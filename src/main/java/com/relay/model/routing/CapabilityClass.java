package com.relay.model.routing;

import java.util.Locale;

/**
 * Coarse request type used to match models and baseline quality.
 */
public enum CapabilityClass {
    CHAT,
    CODE,
    ANALYSIS,
    CREATIVE,
    SUPPORT,
    TOOLS;

    public static CapabilityClass fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown capability: " + value, e);
        }
    }
}
