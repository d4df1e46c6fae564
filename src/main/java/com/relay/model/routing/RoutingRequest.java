package com.relay.model.routing;

import com.relay.model.ChatCompletionRequest;
import com.relay.model.Message;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Normalized, immutable chat request as seen by the routing engine.
 */
@Value
@Builder(toBuilder = true)
public class RoutingRequest {

    @NonNull
    String requestId;

    @NonNull
    String userId;

    @NonNull
    List<Message> messages;

    /** Requested model or provider family; null or "auto" lets the router choose. */
    String modelHint;

    CapabilityClass capability;

    @Builder.Default
    OptimizationStrategy optimizeFor = OptimizationStrategy.BALANCED;

    @Builder.Default
    RoutingConstraints constraints = RoutingConstraints.NONE;

    boolean stream;

    Integer maxTokens;

    boolean hasTools;

    /** Original payload, forwarded upstream after model resolution. */
    ChatCompletionRequest payload;

    public boolean hasModelHint() {
        return modelHint != null && !modelHint.isBlank() && !"auto".equalsIgnoreCase(modelHint);
    }
}
