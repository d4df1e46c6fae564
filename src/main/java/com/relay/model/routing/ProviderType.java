package com.relay.model.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of upstream providers Relay can route to.
 */
public enum ProviderType {

    OPENAI("openai", FramingMode.SSE),
    ANTHROPIC("anthropic", FramingMode.SSE),
    GOOGLE("google", FramingMode.SSE),
    LOCAL("local", FramingMode.NDJSON);

    private final String id;
    private final FramingMode framing;

    ProviderType(String id, FramingMode framing) {
        this.id = id;
        this.framing = framing;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public FramingMode framing() {
        return framing;
    }

    /**
     * Parse a provider name. Accepts the enum name, the lower-case id and "ollama" for LOCAL.
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static ProviderType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("ollama".equals(normalized)) {
            return LOCAL;
        }
        for (ProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
