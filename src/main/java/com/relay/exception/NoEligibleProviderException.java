package com.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * Constraints or preferences eliminated every candidate. Never retried.
 */
public class NoEligibleProviderException extends RelayException {

    public NoEligibleProviderException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @Override
    public String getCode() {
        return "no_eligible_provider";
    }
}
