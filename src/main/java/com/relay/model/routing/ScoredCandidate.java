package com.relay.model.routing;

import lombok.Value;

/**
 * A prediction with its strategy score and rank (0 is the winner).
 */
@Value
public class ScoredCandidate {

    CandidatePrediction prediction;
    double score;
    int rank;

    public ProviderType getProvider() {
        return prediction.getProvider();
    }

    public String getModel() {
        return prediction.getModel();
    }
}
