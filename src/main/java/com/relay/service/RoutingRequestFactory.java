package com.relay.service;

import com.relay.config.RelayProperties;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.RoutingHints;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.RoutingConstraints;
import com.relay.model.routing.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Builds a {@link RoutingRequest} from the wire request and header hints. Headers win over body fields.
 */
@Component
public class RoutingRequestFactory {

    public static final String ANONYMOUS_USER = "anonymous";

    private final OptimizationStrategy defaultStrategy;

    public RoutingRequestFactory(RelayProperties properties) {
        this.defaultStrategy = properties.getRouting().getDefaultStrategy();
    }

    public RoutingRequest create(ChatCompletionRequest body, RoutingHints hints) {
        return create(body, hints, newRequestId());
    }

    /**
     * @throws IllegalArgumentException if the request has no messages or carries malformed hints
     */
    public RoutingRequest create(ChatCompletionRequest body, RoutingHints hints, String requestId) {
        if (body == null || body.getMessages() == null || body.getMessages().isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        RoutingHints h = hints != null ? hints : RoutingHints.NONE;

        OptimizationStrategy strategy = h.getOptimizeFor();
        if (strategy == null) {
            strategy = body.getOptimizeFor() != null
                    ? OptimizationStrategy.fromString(body.getOptimizeFor()) : defaultStrategy;
        }

        RoutingConstraints constraints = constraints(body.getConstraints(), h);
        constraints.validate();

        return RoutingRequest.builder()
                .requestId(requestId)
                .userId(userId(body, h))
                .messages(body.getMessages())
                .modelHint(body.getModel())
                .capability(CapabilityClass.fromString(body.getCapability()))
                .optimizeFor(strategy)
                .constraints(constraints)
                .stream(Boolean.TRUE.equals(body.getStream()))
                .maxTokens(body.getMaxTokens())
                .hasTools(body.getTools() != null && !body.getTools().isEmpty())
                .payload(body)
                .build();
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    private static String userId(ChatCompletionRequest body, RoutingHints hints) {
        if (hints.getUserId() != null) {
            return hints.getUserId();
        }
        if (body.getUser() != null && !body.getUser().isBlank()) {
            return body.getUser().trim();
        }
        return ANONYMOUS_USER;
    }

    private static RoutingConstraints constraints(ChatCompletionRequest.Constraints wire, RoutingHints hints) {
        RoutingConstraints.RoutingConstraintsBuilder builder = RoutingConstraints.builder();
        if (wire != null) {
            builder.maxCost(wire.getMaxCost())
                    .minQuality(wire.getMinQuality())
                    .maxResponseTimeMs(wire.getMaxResponseTimeMs())
                    .preferredProviders(providers(wire.getPreferredProviders()))
                    .excludeProviders(providers(wire.getExcludeProviders()));
        }
        if (hints.getMaxCost() != null) {
            builder.maxCost(hints.getMaxCost());
        }
        if (hints.getMinQuality() != null) {
            builder.minQuality(hints.getMinQuality());
        }
        if (hints.getMaxResponseTimeMs() != null) {
            builder.maxResponseTimeMs(hints.getMaxResponseTimeMs());
        }
        if (hints.getPreferredProviders() != null) {
            builder.preferredProviders(Set.copyOf(hints.getPreferredProviders()));
        }
        if (hints.getExcludeProviders() != null) {
            builder.excludeProviders(Set.copyOf(hints.getExcludeProviders()));
        }
        return builder.build();
    }

    private static Set<ProviderType> providers(Set<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        Set<ProviderType> providers = EnumSet.noneOf(ProviderType.class);
        for (String name : names) {
            providers.add(ProviderType.fromString(name));
        }
        return Set.copyOf(providers);
    }
}
