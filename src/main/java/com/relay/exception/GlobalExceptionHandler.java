package com.relay.exception;

import com.relay.model.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Renders failures as {@link ApiError} bodies with the status each exception carries.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(QuotaExhaustedException.class)
    public ResponseEntity<ApiError> handleQuota(QuotaExhaustedException ex) {
        log.info("Quota refusal: {}", ex.getMessage());
        return respond(ex, ApiError.builder().upgradePrompt(ex.getUpgradePrompt()));
    }

    @ExceptionHandler(ProviderDispatchException.class)
    public ResponseEntity<ApiError> handleDispatch(ProviderDispatchException ex) {
        log.warn("Dispatch failed after {}: {}", ex.getAttemptedProviders(), ex.getMessage());
        return respond(ex, ApiError.builder()
                .attemptedProviders(ex.getAttemptedProviders().isEmpty() ? null : ex.getAttemptedProviders()));
    }

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<ApiError> handleRelay(RelayException ex) {
        log.debug("{}: {}", ex.getCode(), ex.getMessage());
        return respond(ex, ApiError.builder());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("invalid_request")
                .message(ex instanceof ServerWebInputException ? ((ServerWebInputException) ex).getReason()
                        : ex.getMessage())
                .build());
    }

    private static ResponseEntity<ApiError> respond(RelayException ex, ApiError.ApiErrorBuilder body) {
        return ResponseEntity.status(ex.getStatus()).body(body
                .status(ex.getStatus().value())
                .error(ex.getCode())
                .message(ex.getMessage())
                .build());
    }
}
