package com.relay.service.routing;

import com.relay.model.ChatCompletionResponse;
import com.relay.model.routing.RoutingDecision;
import lombok.Value;

/**
 * A completed, routed request: the provider's response plus where it went.
 */
@Value
public class RoutedCompletion {

    ChatCompletionResponse response;
    RoutingDecision decision;

    /** Remaining instant-tier requests today; null for uncapped tiers. */
    Long quotaRemaining;

    long latencyMs;
}
