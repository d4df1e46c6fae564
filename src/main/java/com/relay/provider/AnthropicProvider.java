package com.relay.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.config.RelayProperties;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.Choice;
import com.relay.model.Message;
import com.relay.model.Usage;
import com.relay.model.routing.ProviderType;
import com.relay.service.streaming.FinishReasons;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Anthropic (Claude) chat completion provider, speaking the Messages API.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractChatProvider {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnthropicProvider(WebClient webClient, RelayProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(webClient, properties, "anthropic");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey) {
        if (!isEnabled()) {
            return notEnabled();
        }

        log.info("Forwarding request to Anthropic: model={}", request.getModel());

        Mono<ChatCompletionResponse> responseMono = post(toAnthropicFormat(request, false), apiKey)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> toOpenAIFormat(response, request.getModel()));

        return execute(responseMono);
    }

    @Override
    public Flux<byte[]> stream(ChatCompletionRequest request, String apiKey) {
        if (!isEnabled()) {
            return Flux.from(notEnabled());
        }
        log.info("Opening Anthropic stream: model={}", request.getModel());
        return executeStream(post(toAnthropicFormat(request, true), apiKey));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    private WebClient.RequestHeadersSpec<?> post(JsonNode body, String apiKey) {
        return webClient.post()
                .uri(config.getBaseUrl() + "/v1/messages")
                .header("x-api-key", resolveKey(apiKey))
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(body.toString());
    }

    /**
     * Convert OpenAI request to Anthropic format. System messages are lifted into the top-level
     * {@code system} field.
     */
    JsonNode toAnthropicFormat(ChatCompletionRequest request, boolean streaming) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getModel());

        StringBuilder system = new StringBuilder();
        ArrayNode messages = body.putArray("messages");
        for (Message msg : request.getMessages()) {
            if (msg.isSystem()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(msg.getContent());
                continue;
            }
            ObjectNode anthropicMsg = messages.addObject();
            anthropicMsg.put("role", Message.ROLE_ASSISTANT.equals(msg.getRole())
                    ? Message.ROLE_ASSISTANT : Message.ROLE_USER);
            ObjectNode text = anthropicMsg.putArray("content").addObject();
            text.put("type", "text");
            text.put("text", msg.getContent() != null ? msg.getContent() : "");
        }
        if (system.length() > 0) {
            body.put("system", system.toString());
        }

        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS);
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            body.put("top_p", request.getTopP());
        }
        if (streaming) {
            body.put("stream", true);
        }
        return body;
    }

    ChatCompletionResponse toOpenAIFormat(JsonNode response, String model) {
        StringBuilder content = new StringBuilder();
        JsonNode blocks = response.path("content");
        if (blocks.isArray()) {
            for (JsonNode block : blocks) {
                if ("text".equals(block.path("type").asText())) {
                    content.append(block.path("text").asText());
                }
            }
        }

        Choice choice = Choice.builder()
                .index(0)
                .message(Message.of(Message.ROLE_ASSISTANT, content.toString()))
                .finishReason(FinishReasons.fromAnthropic(response.path("stop_reason").textValue()))
                .build();

        Usage usage = null;
        JsonNode usageNode = response.get("usage");
        if (usageNode != null) {
            usage = Usage.of(
                    usageNode.has("input_tokens") ? usageNode.get("input_tokens").asInt() : null,
                    usageNode.has("output_tokens") ? usageNode.get("output_tokens").asInt() : null);
        }

        return ChatCompletionResponse.builder()
                .id(response.hasNonNull("id")
                        ? "chatcmpl-" + response.get("id").asText()
                        : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .object("chat.completion")
                .created(clock.instant().getEpochSecond())
                .model(model)
                .choices(List.of(choice))
                .usage(usage)
                .build();
    }
}
