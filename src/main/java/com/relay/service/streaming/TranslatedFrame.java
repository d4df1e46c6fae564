package com.relay.service.streaming;

import lombok.Value;

/**
 * What one provider framing unit means in canonical terms.
 */
@Value
public class TranslatedFrame {

    String content;
    /** Canonical finish reason; null unless this frame ends the stream. */
    String finishReason;
    boolean terminal;

    public static TranslatedFrame content(String content) {
        return new TranslatedFrame(content, null, false);
    }

    public static TranslatedFrame terminal(String finishReason) {
        return new TranslatedFrame(null, finishReason != null ? finishReason : FinishReasons.STOP, true);
    }

    public static TranslatedFrame of(String content, String finishReason) {
        if (finishReason == null) {
            return content(content);
        }
        return new TranslatedFrame(content, finishReason, true);
    }
}
