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
 * Google Gemini provider. Streams with {@code alt=sse} so frames arrive as server-sent events.
 */
@Slf4j
@Component
public class GoogleProvider extends AbstractChatProvider {

    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GoogleProvider(WebClient webClient, RelayProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(webClient, properties, "google");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.GOOGLE;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey) {
        if (!isEnabled()) {
            return notEnabled();
        }

        log.info("Forwarding request to Google: model={}", request.getModel());

        Mono<ChatCompletionResponse> responseMono = post(request, ":generateContent", apiKey)
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
        log.info("Opening Google stream: model={}", request.getModel());
        return executeStream(post(request, ":streamGenerateContent?alt=sse", apiKey));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    private WebClient.RequestHeadersSpec<?> post(ChatCompletionRequest request, String method, String apiKey) {
        return webClient.post()
                .uri(config.getBaseUrl() + "/v1beta/models/" + request.getModel() + method)
                .header(API_KEY_HEADER, resolveKey(apiKey))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(toGoogleFormat(request).toString());
    }

    /**
     * Convert OpenAI request to a GenerateContentRequest. Assistant turns become role {@code model}.
     */
    JsonNode toGoogleFormat(ChatCompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode contents = body.putArray("contents");
        StringBuilder system = new StringBuilder();
        for (Message msg : request.getMessages()) {
            String text = msg.getContent() != null ? msg.getContent() : "";
            if (msg.isSystem()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(text);
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", Message.ROLE_ASSISTANT.equals(msg.getRole()) ? "model" : "user");
            content.putArray("parts").addObject().put("text", text);
        }
        if (system.length() > 0) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system.toString());
        }

        ObjectNode generation = body.putObject("generationConfig");
        if (request.getMaxTokens() != null) {
            generation.put("maxOutputTokens", request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            generation.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            generation.put("topP", request.getTopP());
        }
        return body;
    }

    ChatCompletionResponse toOpenAIFormat(JsonNode response, String model) {
        JsonNode candidate = response.path("candidates").path(0);
        StringBuilder content = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            content.append(part.path("text").asText(""));
        }

        Choice choice = Choice.builder()
                .index(0)
                .message(Message.of(Message.ROLE_ASSISTANT, content.toString()))
                .finishReason(FinishReasons.fromGoogle(candidate.path("finishReason").textValue()))
                .build();

        Usage usage = null;
        JsonNode usageNode = response.get("usageMetadata");
        if (usageNode != null) {
            usage = Usage.of(
                    usageNode.has("promptTokenCount") ? usageNode.get("promptTokenCount").asInt() : null,
                    usageNode.has("candidatesTokenCount") ? usageNode.get("candidatesTokenCount").asInt() : null);
        }

        return ChatCompletionResponse.builder()
                .id("chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .object("chat.completion")
                .created(clock.instant().getEpochSecond())
                .model(model)
                .choices(List.of(choice))
                .usage(usage)
                .build();
    }
}
