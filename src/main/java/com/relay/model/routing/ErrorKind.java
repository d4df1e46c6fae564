package com.relay.model.routing;

import com.relay.exception.ProviderDispatchException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Why an execution failed.
 */
public enum ErrorKind {
    TIMEOUT,
    RATE_LIMITED,
    AUTH,
    PROVIDER_ERROR,
    TRANSPORT,
    CANCELLED,
    UNKNOWN;

    /**
     * Classify a dispatch failure.
     */
    public static ErrorKind classify(Throwable error) {
        Throwable cause = error;
        if (cause instanceof ProviderDispatchException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (cause instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) cause).getStatusCode().value();
            if (status == 401 || status == 403) {
                return AUTH;
            }
            if (status == 429) {
                return RATE_LIMITED;
            }
            return PROVIDER_ERROR;
        }
        if (cause instanceof WebClientRequestException) {
            return TRANSPORT;
        }
        return UNKNOWN;
    }
}
