package com.relay.service.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.exception.ProviderDispatchException;
import com.relay.model.routing.ProviderType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Anthropic SSE events, discriminated by {@code type}. Text arrives in {@code content_block_delta},
 * the stop reason in {@code message_delta}, and {@code message_stop} closes the message.
 */
@Component
public class AnthropicFrameTranslator extends AbstractJsonFrameTranslator {

    public AnthropicFrameTranslator(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderType provider() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    public Optional<TranslatedFrame> translateFrame(String unit) {
        if (OpenAIFrameTranslator.DONE.equals(unit.trim())) {
            return Optional.of(TranslatedFrame.terminal(FinishReasons.STOP));
        }
        JsonNode node = parse(unit);
        String type = node.path("type").asText("");

        switch (type) {
            case "content_block_delta": {
                String text = textOrNull(node.path("delta").path("text"));
                return text == null || text.isEmpty() ? Optional.empty() : Optional.of(TranslatedFrame.content(text));
            }
            case "message_delta": {
                String stopReason = textOrNull(node.path("delta").path("stop_reason"));
                return stopReason == null
                        ? Optional.empty()
                        : Optional.of(TranslatedFrame.terminal(FinishReasons.fromAnthropic(stopReason)));
            }
            case "message_stop":
                return Optional.of(TranslatedFrame.terminal(FinishReasons.STOP));
            case "error":
                throw new ProviderDispatchException("anthropic stream error: "
                        + node.path("error").path("message").asText("unknown error"), null);
            default:
                // message_start, content_block_start/stop, ping
                return Optional.empty();
        }
    }
}
