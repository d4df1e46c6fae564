package com.relay.model.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * What actually happened when a request was executed. Write-once per request id.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionOutcome {

    @NonNull
    String requestId;

    @NonNull
    ProviderType provider;

    @NonNull
    String model;

    double cost;
    long latencyMs;
    boolean success;
    ErrorKind errorKind;

    /** Optional quality score in [0, 1]. */
    Double qualityScore;

    Instant completedAt;

    public ModelKey key() {
        return ModelKey.of(provider, model);
    }
}
