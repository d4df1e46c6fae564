package com.relay.service.prediction;

import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ProviderType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What the router has learned about one user's recent requests.
 */
@Value
@Builder
public class UserPatternInsights {

    String userId;
    int requestsTracked;
    List<TypeShare> commonRequestTypes;
    List<ProviderShare> preferredProviders;
    double averageComplexity;
    /** Spend saved against always taking the dearest admissible candidate, in percent. */
    double costSavingsPercent;
    /** Null until enough requests were seen. */
    String patternId;
    Instant lastSeen;

    @Value
    public static class TypeShare {
        CapabilityClass type;
        int count;
        double frequency;
    }

    @Value
    public static class ProviderShare {
        ProviderType provider;
        int count;
        double share;
    }
}
