package com.relay.model.routing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Record of how a request was routed: the winner, the full ranked list and what happened at dispatch.
 */
@Value
@Builder(toBuilder = true)
public class RoutingDecision {

    String requestId;
    String userId;
    ProviderType provider;
    String model;
    OptimizationStrategy strategy;
    String reasoning;

    CandidatePrediction chosen;

    /** Every surviving candidate, ranked. Index 0 is the chosen one. */
    List<ScoredCandidate> alternatives;

    @Singular
    List<ProviderType> attemptedProviders;

    boolean fallback;
    RoutingState state;
    String failureReason;
    Instant decidedAt;

    /** Set when the request was routed by a running experiment. */
    String experimentId;
    Variant variant;

    /**
     * The decision after a successful dispatch to {@code candidate}.
     */
    public RoutingDecision dispatchedTo(ScoredCandidate candidate, boolean viaFallback) {
        return toBuilder()
                .provider(candidate.getProvider())
                .model(candidate.getModel())
                .chosen(candidate.getPrediction())
                .fallback(viaFallback)
                .state(viaFallback ? RoutingState.FALLBACK_DISPATCHED : RoutingState.DISPATCHED)
                .build();
    }

    public RoutingDecision failed(String reason) {
        return toBuilder()
                .state(RoutingState.FAILED)
                .failureReason(reason)
                .build();
    }
}
