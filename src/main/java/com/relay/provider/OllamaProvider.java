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
 * Self-hosted models behind an Ollama server. Streams newline-delimited JSON from {@code /api/chat}.
 */
@Slf4j
@Component
public class OllamaProvider extends AbstractChatProvider {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OllamaProvider(WebClient webClient, RelayProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(webClient, properties, "local");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.LOCAL;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey) {
        if (!isEnabled()) {
            return notEnabled();
        }

        log.info("Forwarding request to Ollama: model={}", request.getModel());

        Mono<ChatCompletionResponse> responseMono = post(request, false, apiKey)
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
        log.info("Opening Ollama stream: model={}", request.getModel());
        return executeStream(post(request, true, apiKey));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    private WebClient.RequestHeadersSpec<?> post(ChatCompletionRequest request, boolean streaming, String apiKey) {
        WebClient.RequestBodySpec spec = webClient.post()
                .uri(config.getBaseUrl() + "/api/chat")
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        // Plain Ollama needs no credential; a fronting proxy may
        String key = resolveKey(apiKey);
        if (key != null && !key.isBlank()) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + key);
        }
        return spec.bodyValue(toOllamaFormat(request, streaming).toString());
    }

    JsonNode toOllamaFormat(ChatCompletionRequest request, boolean streaming) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getModel());
        body.put("stream", streaming);
        ArrayNode messages = body.putArray("messages");
        for (Message msg : request.getMessages()) {
            ObjectNode message = messages.addObject();
            message.put("role", msg.getRole());
            message.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        ObjectNode options = body.putObject("options");
        if (request.getMaxTokens() != null) {
            options.put("num_predict", request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            options.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            options.put("top_p", request.getTopP());
        }
        return body;
    }

    ChatCompletionResponse toOpenAIFormat(JsonNode response, String model) {
        Choice choice = Choice.builder()
                .index(0)
                .message(Message.of(Message.ROLE_ASSISTANT, response.path("message").path("content").asText("")))
                .finishReason(FinishReasons.fromOllama(response.path("done_reason").textValue()))
                .build();

        Usage usage = Usage.of(
                response.has("prompt_eval_count") ? response.get("prompt_eval_count").asInt() : null,
                response.has("eval_count") ? response.get("eval_count").asInt() : null);

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
