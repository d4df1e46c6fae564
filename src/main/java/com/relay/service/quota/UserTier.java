package com.relay.service.quota;

import java.util.Locale;

public enum UserTier {
    /** Zero-setup access with a small shared daily cap. */
    INSTANT,
    /** User attached their own provider credential. */
    CONNECTED,
    PAID;

    public boolean isCapped() {
        return this == INSTANT;
    }

    public static UserTier fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Tier must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tier: " + value, e);
        }
    }
}
