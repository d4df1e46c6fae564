package com.relay.service;

import com.relay.exception.ProviderDispatchException;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.routing.ProviderType;
import com.relay.provider.ChatProvider;
import com.relay.service.routing.ProviderAvailability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the provider adapter for a routed provider and forwards calls to it.
 */
@Slf4j
@Service
public class ProviderService implements ProviderAvailability {

    private final Map<ProviderType, ChatProvider> providers = new EnumMap<>(ProviderType.class);

    public ProviderService(List<ChatProvider> providers) {
        for (ChatProvider provider : providers) {
            this.providers.put(provider.getType(), provider);
        }
        log.info("Initialized ProviderService with {} providers, enabled: {}",
                providers.size(),
                providers.stream().filter(ChatProvider::isEnabled).map(ChatProvider::getName).toList());
    }

    @Override
    public boolean isRoutable(ProviderType provider) {
        ChatProvider adapter = providers.get(provider);
        return adapter != null && adapter.isEnabled();
    }

    public boolean supportsStreaming(ProviderType provider) {
        return getProvider(provider).map(ChatProvider::supportsStreaming).orElse(false);
    }

    /**
     * Forward a completion to the given provider using the allocated pool credential.
     */
    public Mono<ChatCompletionResponse> forward(ProviderType type, ChatCompletionRequest request, String apiKey) {
        ChatProvider provider = getProvider(type).filter(ChatProvider::isEnabled).orElse(null);
        if (provider == null) {
            log.error("No enabled provider for {}", type);
            return Mono.error(new ProviderDispatchException("Provider not available: " + type, null));
        }

        log.info("Dispatching model '{}' to provider '{}'", request.getModel(), provider.getName());

        return provider.complete(request, apiKey)
                .doOnSuccess(response -> log.info("Successfully received response from provider: {}",
                        provider.getName()))
                .doOnError(error -> log.error("Error from provider {}: {}",
                        provider.getName(), error.getMessage()));
    }

    /**
     * Open a raw streaming connection to the given provider.
     */
    public Flux<byte[]> openStream(ProviderType type, ChatCompletionRequest request, String apiKey) {
        ChatProvider provider = getProvider(type).filter(ChatProvider::isEnabled).orElse(null);
        if (provider == null) {
            return Flux.error(new ProviderDispatchException("Provider not available: " + type, null));
        }
        log.info("Streaming model '{}' from provider '{}'", request.getModel(), provider.getName());
        return provider.stream(request, apiKey);
    }

    public List<ChatProvider> getProviders() {
        return List.copyOf(providers.values());
    }

    public Optional<ChatProvider> getProvider(ProviderType type) {
        return Optional.ofNullable(providers.get(type));
    }
}
