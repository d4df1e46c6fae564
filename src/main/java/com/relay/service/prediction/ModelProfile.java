package com.relay.service.prediction;

import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Static price, latency and quality figures for one (provider, model).
 */
@Value
@Builder
public class ModelProfile {

    ProviderType provider;
    String model;
    double inputCostPer1k;
    double outputCostPer1k;
    long baseLatencyMs;
    double latencyPerTokenMs;
    double baselineQuality;
    @Singular
    Set<CapabilityClass> capabilities;
    boolean streaming;

    public ModelKey key() {
        return ModelKey.of(provider, model);
    }

    public boolean supports(CapabilityClass capability) {
        return capability == null || capabilities.contains(capability);
    }

    public double costFor(long promptTokens, long completionTokens) {
        return promptTokens / 1000.0 * inputCostPer1k + completionTokens / 1000.0 * outputCostPer1k;
    }

    public long latencyFor(long completionTokens) {
        return Math.round(baseLatencyMs + latencyPerTokenMs * completionTokens);
    }
}
