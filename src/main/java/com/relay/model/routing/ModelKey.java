package com.relay.model.routing;

import lombok.NonNull;
import lombok.Value;

/**
 * A (provider, model) pair, the unit of prediction, calibration and monitoring.
 */
@Value
public class ModelKey {

    @NonNull
    ProviderType provider;

    @NonNull
    String model;

    public static ModelKey of(ProviderType provider, String model) {
        return new ModelKey(provider, model);
    }

    @Override
    public String toString() {
        return provider.id() + "/" + model;
    }
}
