package com.relay.provider;

import com.relay.config.RelayProperties;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.routing.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * OpenAI chat completion provider. The request is already in OpenAI shape and passes through.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractChatProvider {

    public OpenAIProvider(WebClient webClient, RelayProperties properties) {
        super(webClient, properties, "openai");
    }

    @Override
    public ProviderType getType() {
        return ProviderType.OPENAI;
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey) {
        if (!isEnabled()) {
            return notEnabled();
        }

        log.info("Forwarding request to OpenAI: model={}", request.getModel());

        Mono<ChatCompletionResponse> responseMono = post(request, apiKey)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class);

        return execute(responseMono);
    }

    @Override
    public Flux<byte[]> stream(ChatCompletionRequest request, String apiKey) {
        if (!isEnabled()) {
            return Flux.from(notEnabled());
        }
        log.info("Opening OpenAI stream: model={}", request.getModel());
        return executeStream(post(request, apiKey));
    }

    private WebClient.RequestHeadersSpec<?> post(ChatCompletionRequest request, String apiKey) {
        return webClient.post()
                .uri(config.getBaseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + resolveKey(apiKey))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(request);
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }
}
