package com.relay.model;

import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Routing hints parsed from request headers. Null fields were not supplied.
 */
@Value
@Builder
public class RoutingHints {

    public static final RoutingHints NONE = RoutingHints.builder().build();

    String userId;
    OptimizationStrategy optimizeFor;
    Double maxCost;
    Double minQuality;
    Long maxResponseTimeMs;
    Set<ProviderType> preferredProviders;
    Set<ProviderType> excludeProviders;
}
