package com.relay.service.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.routing.ProviderType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Ollama {@code /api/chat} NDJSON: {@code message.content} per line, {@code done: true} on the last.
 */
@Component
public class LocalFrameTranslator extends AbstractJsonFrameTranslator {

    public LocalFrameTranslator(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType provider() {
        return ProviderType.LOCAL;
    }

    @Override
    public Optional<TranslatedFrame> translateFrame(String unit) {
        JsonNode node = parse(unit);
        failOnError(node);

        String content = textOrNull(node.path("message").path("content"));
        if (content == null) {
            content = textOrNull(node.get("response")); // /api/generate shape
        }
        boolean done = node.path("done").asBoolean(false);
        if (done) {
            return Optional.of(TranslatedFrame.of(content == null || content.isEmpty() ? null : content,
                    FinishReasons.fromOllama(textOrNull(node.get("done_reason")))));
        }
        return content == null || content.isEmpty() ? Optional.empty() : Optional.of(TranslatedFrame.content(content));
    }
}
