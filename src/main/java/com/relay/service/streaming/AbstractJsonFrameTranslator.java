package com.relay.service.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.exception.MalformedStreamFrameException;
import com.relay.exception.ProviderDispatchException;

/**
 * JSON parsing shared by the translators.
 */
public abstract class AbstractJsonFrameTranslator implements StreamFrameTranslator {

    protected final ObjectMapper objectMapper;

    protected AbstractJsonFrameTranslator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected JsonNode parse(String unit) {
        try {
            JsonNode node = objectMapper.readTree(unit);
            if (node == null || !node.isObject()) {
                throw new MalformedStreamFrameException(provider() + " frame is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedStreamFrameException("Unparseable " + provider() + " frame", e);
        }
    }

    /**
     * An in-band error reported by the provider ends the stream as a dispatch failure.
     */
    protected void failOnError(JsonNode node) {
        JsonNode error = node.get("error");
        if (error != null && !error.isNull()) {
            String message = error.isTextual() ? error.asText() : error.path("message").asText("unknown error");
            throw new ProviderDispatchException(provider() + " stream error: " + message, null);
        }
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }
}
