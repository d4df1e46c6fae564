package com.relay.service.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.routing.ProviderType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Google {@code streamGenerateContent?alt=sse}: one GenerateContentResponse per event, text in
 * {@code candidates[0].content.parts[].text}, end marked by {@code finishReason}.
 */
@Component
public class GoogleFrameTranslator extends AbstractJsonFrameTranslator {

    public GoogleFrameTranslator(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType provider() {
        return ProviderType.GOOGLE;
    }

    @Override
    public Optional<TranslatedFrame> translateFrame(String unit) {
        JsonNode node = parse(unit);
        failOnError(node);

        JsonNode candidate = node.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            String value = textOrNull(part.get("text"));
            if (value != null) {
                text.append(value);
            }
        }
        String finishReason = textOrNull(candidate.get("finishReason"));
        String content = text.length() > 0 ? text.toString() : null;
        if (content == null && finishReason == null) {
            return Optional.empty();
        }
        return Optional.of(TranslatedFrame.of(content,
                finishReason != null ? FinishReasons.fromGoogle(finishReason) : null));
    }
}
