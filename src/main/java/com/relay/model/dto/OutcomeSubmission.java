package com.relay.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.relay.model.routing.ErrorKind;
import com.relay.model.routing.ExecutionOutcome;
import com.relay.model.routing.ProviderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome reported by an external dispatcher for a decide-only request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeSubmission {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("model")
    private String model;

    @JsonProperty("cost")
    private Double cost;

    @JsonProperty("latency_ms")
    private Long latencyMs;

    @JsonProperty("success")
    private Boolean success;

    @JsonProperty("error_kind")
    private String errorKind;

    @JsonProperty("quality_score")
    private Double qualityScore;

    /**
     * @throws IllegalArgumentException if a required field is missing or out of range
     */
    public ExecutionOutcome toOutcome(Instant completedAt) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("request_id is required");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        if (cost != null && cost < 0) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
        if (latencyMs != null && latencyMs < 0) {
            throw new IllegalArgumentException("latency_ms must be >= 0");
        }
        if (qualityScore != null && (qualityScore < 0 || qualityScore > 1)) {
            throw new IllegalArgumentException("quality_score must be within [0, 1]");
        }
        boolean succeeded = success == null || success;
        return ExecutionOutcome.builder()
                .requestId(requestId)
                .provider(ProviderType.fromString(provider))
                .model(model)
                .cost(cost != null ? cost : 0.0)
                .latencyMs(latencyMs != null ? latencyMs : 0L)
                .success(succeeded)
                .errorKind(succeeded ? null : parseErrorKind())
                .qualityScore(qualityScore)
                .completedAt(completedAt)
                .build();
    }

    private ErrorKind parseErrorKind() {
        if (errorKind == null || errorKind.isBlank()) {
            return ErrorKind.UNKNOWN;
        }
        try {
            return ErrorKind.valueOf(errorKind.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown error_kind: " + errorKind, e);
        }
    }
}
