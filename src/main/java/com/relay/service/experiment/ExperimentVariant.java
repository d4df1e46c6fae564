package com.relay.service.experiment;

import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import lombok.Value;

/**
 * One arm of an experiment: the model it forces and the share of participants it receives.
 */
@Value
public class ExperimentVariant {

    ProviderType provider;
    String model;
    double weight;

    public ModelKey key() {
        return ModelKey.of(provider, model);
    }
}
