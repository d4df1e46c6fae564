package com.relay.service.streaming;

import com.relay.exception.MalformedStreamFrameException;
import com.relay.model.routing.ProviderType;

import java.util.Optional;

/**
 * Translates one provider framing unit into canonical terms. One implementation per {@link ProviderType}.
 */
public interface StreamFrameTranslator {

    ProviderType provider();

    /**
     * @param unit one complete framing unit (SSE data payload or NDJSON line)
     * @return the frame, or empty when the unit carries neither content nor a terminal signal
     * @throws MalformedStreamFrameException when the unit cannot be parsed
     */
    Optional<TranslatedFrame> translateFrame(String unit);
}
