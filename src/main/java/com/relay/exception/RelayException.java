package com.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures Relay reports to its callers.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * HTTP status used when this failure reaches a controller.
     */
    public abstract HttpStatus getStatus();

    /**
     * Stable machine-readable error code.
     */
    public abstract String getCode();
}
