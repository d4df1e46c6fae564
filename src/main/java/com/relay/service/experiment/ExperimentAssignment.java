package com.relay.service.experiment;

import com.relay.model.routing.ProviderType;
import com.relay.model.routing.ScoredCandidate;
import com.relay.model.routing.Variant;
import lombok.Value;

@Value
public class ExperimentAssignment {

    String experimentId;
    Variant variant;
    ProviderType provider;
    String model;

    public boolean matches(ScoredCandidate candidate) {
        return candidate.getProvider() == provider && candidate.getModel().equals(model);
    }
}
