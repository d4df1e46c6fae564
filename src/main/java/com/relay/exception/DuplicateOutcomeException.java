package com.relay.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * An outcome for this request id was already recorded.
 */
@Getter
public class DuplicateOutcomeException extends RelayException {

    private final String requestId;

    public DuplicateOutcomeException(String requestId) {
        super("Outcome already recorded for request " + requestId);
        this.requestId = requestId;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getCode() {
        return "duplicate_outcome";
    }
}
