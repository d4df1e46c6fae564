package com.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * An experiment operation that its current state does not allow, or a duplicate experiment id.
 */
public class ExperimentStateException extends RelayException {

    public ExperimentStateException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getCode() {
        return "experiment_conflict";
    }
}
