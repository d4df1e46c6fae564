package com.relay.model.routing;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Hard constraints attached to a routing request. A candidate violating any of them is never selected.
 */
@Value
@Builder(toBuilder = true)
public class RoutingConstraints {

    public static final RoutingConstraints NONE = RoutingConstraints.builder().build();

    Double maxCost;
    Double minQuality;
    Long maxResponseTimeMs;

    @Builder.Default
    Set<ProviderType> preferredProviders = Set.of();

    @Builder.Default
    Set<ProviderType> excludeProviders = Set.of();

    public boolean hasPreferredProviders() {
        return preferredProviders != null && !preferredProviders.isEmpty();
    }

    public boolean isExcluded(ProviderType provider) {
        return excludeProviders != null && excludeProviders.contains(provider);
    }

    public boolean isAllowed(ProviderType provider) {
        if (isExcluded(provider)) {
            return false;
        }
        return !hasPreferredProviders() || preferredProviders.contains(provider);
    }

    /**
     * @throws IllegalArgumentException if a bound is out of range
     */
    public void validate() {
        if (maxCost != null && maxCost < 0) {
            throw new IllegalArgumentException("maxCost must be >= 0");
        }
        if (minQuality != null && (minQuality < 0 || minQuality > 1)) {
            throw new IllegalArgumentException("minQuality must be within [0, 1]");
        }
        if (maxResponseTimeMs != null && maxResponseTimeMs <= 0) {
            throw new IllegalArgumentException("maxResponseTimeMs must be > 0");
        }
    }
}
