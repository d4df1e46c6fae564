package com.relay.service.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.routing.ProviderType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * OpenAI SSE: {@code choices[0].delta.content}, {@code choices[0].finish_reason}, then a {@code [DONE]} sentinel.
 */
@Component
public class OpenAIFrameTranslator extends AbstractJsonFrameTranslator {

    static final String DONE = "[DONE]";

    public OpenAIFrameTranslator(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType provider() {
        return ProviderType.OPENAI;
    }

    @Override
    public Optional<TranslatedFrame> translateFrame(String unit) {
        if (DONE.equals(unit.trim())) {
            return Optional.of(TranslatedFrame.terminal(FinishReasons.STOP));
        }
        JsonNode node = parse(unit);
        failOnError(node);

        JsonNode choice = node.path("choices").path(0);
        if (choice.isMissingNode()) {
            return Optional.empty();
        }
        String content = textOrNull(choice.path("delta").path("content"));
        String finishReason = textOrNull(choice.get("finish_reason"));
        if ((content == null || content.isEmpty()) && finishReason == null) {
            return Optional.empty();
        }
        return Optional.of(TranslatedFrame.of(content, finishReason));
    }
}
