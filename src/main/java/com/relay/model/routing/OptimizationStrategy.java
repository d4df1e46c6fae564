package com.relay.model.routing;

import java.util.Locale;

/**
 * What the router optimizes for when ranking candidates.
 */
public enum OptimizationStrategy {
    COST,
    SPEED,
    QUALITY,
    BALANCED;

    /**
     * Parse a strategy name; null or blank means BALANCED.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static OptimizationStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown optimization strategy: " + value, e);
        }
    }
}
