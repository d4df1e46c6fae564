package com.relay.exception;

import com.relay.model.routing.ProviderType;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Provider call failed. Thrown by adapters for a single attempt, and by the router once its fallback is
 * spent, carrying every provider tried.
 */
@Getter
public class ProviderDispatchException extends RelayException {

    private final List<ProviderType> attemptedProviders;

    public ProviderDispatchException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ProviderDispatchException(String message, List<ProviderType> attemptedProviders, Throwable cause) {
        super(message, cause);
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public String getCode() {
        return "provider_dispatch_failed";
    }
}
