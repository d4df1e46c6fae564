package com.relay.service.streaming;

import java.util.Locale;

/**
 * Maps provider stop reasons onto OpenAI finish reasons.
 */
public final class FinishReasons {

    public static final String STOP = "stop";
    public static final String LENGTH = "length";
    public static final String CONTENT_FILTER = "content_filter";
    public static final String TOOL_CALLS = "tool_calls";

    private FinishReasons() {
    }

    public static String fromAnthropic(String stopReason) {
        if (stopReason == null) {
            return STOP;
        }
        return switch (stopReason) {
            case "max_tokens" -> LENGTH;
            case "tool_use" -> TOOL_CALLS;
            default -> STOP; // end_turn, stop_sequence
        };
    }

    public static String fromGoogle(String finishReason) {
        if (finishReason == null) {
            return STOP;
        }
        return switch (finishReason.toUpperCase(Locale.ROOT)) {
            case "MAX_TOKENS" -> LENGTH;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT" -> CONTENT_FILTER;
            default -> STOP;
        };
    }

    public static String fromOllama(String doneReason) {
        return "length".equals(doneReason) ? LENGTH : STOP;
    }
}
