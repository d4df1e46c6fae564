package com.relay.provider;

import com.relay.config.RelayProperties;
import com.relay.exception.ProviderDispatchException;
import com.relay.exception.RelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Common plumbing for provider adapters.
 *
 * Adapters make exactly one attempt per call. Failures surface as {@link ProviderDispatchException}
 * and the router decides on fallback.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    protected final WebClient webClient;
    protected final RelayProperties properties;
    protected final RelayProperties.ProviderConfig config;

    protected AbstractChatProvider(WebClient webClient, RelayProperties properties, String providerName) {
        this.webClient = webClient;
        this.properties = properties;
        this.config = properties.getProviders().get(providerName);
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled() && config.getBaseUrl() != null;
    }

    /**
     * Pool credential if one was allocated, else the provider's own key.
     */
    protected String resolveKey(String apiKey) {
        return apiKey != null && !apiKey.isBlank() ? apiKey : config.getApiKey();
    }

    protected <T> Mono<T> notEnabled() {
        return Mono.error(new ProviderDispatchException(getName() + " provider is not enabled", null));
    }

    /**
     * Attach logging and map transport errors into the dispatch taxonomy.
     */
    protected <T> Mono<T> execute(Mono<T> request) {
        return request
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", getName()))
                .doOnError(error -> log.error("Request failed for provider: {}", getName(), error))
                .onErrorMap(error -> !(error instanceof RelayException), this::dispatchFailure);
    }

    /**
     * Raw body bytes of a streaming response, one array per network read.
     */
    protected Flux<byte[]> executeStream(WebClient.RequestHeadersSpec<?> spec) {
        return spec.retrieve()
                .bodyToFlux(DataBuffer.class)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .doOnError(error -> log.error("Stream failed for provider: {}", getName(), error))
                .onErrorMap(error -> !(error instanceof RelayException), this::dispatchFailure);
    }

    private Throwable dispatchFailure(Throwable error) {
        return new ProviderDispatchException(getName() + " request failed: " + error.getMessage(), error);
    }
}
