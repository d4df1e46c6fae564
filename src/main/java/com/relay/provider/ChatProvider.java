package com.relay.provider;

import com.relay.model.ChatCompletionRequest;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.routing.ProviderType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Interface for chat completion providers.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication.
 */
public interface ChatProvider {

    ProviderType getType();

    /**
     * Get provider name (e.g., "openai", "anthropic", "google", "local").
     */
    default String getName() {
        return getType().id();
    }

    /**
     * Complete a chat request.
     *
     * @param request upstream request with a concrete model
     * @param apiKey  credential from the allocated pool; null to use the provider's configured key
     * @return provider response (normalized to OpenAI format)
     */
    Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey);

    /**
     * Open a streaming completion and expose the raw transport bytes, framed as {@link ProviderType#framing()}.
     * Cancelling the returned flux closes the connection.
     */
    default Flux<byte[]> stream(ChatCompletionRequest request, String apiKey) {
        return Flux.error(new UnsupportedOperationException(getName() + " does not support streaming"));
    }

    /**
     * Check if provider is enabled and configured.
     */
    boolean isEnabled();

    default boolean supportsStreaming() {
        return false;
    }
}
