package com.relay.service.routing;

import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.prediction.RequestFeatures;
import lombok.Value;

import java.util.List;

/**
 * Output of the decision stage: the ranked survivors and the decision for the winner.
 */
@Value
public class RoutingPlan {

    RoutingRequest request;
    RequestFeatures features;
    List<ScoredCandidate> ranked;
    RoutingDecision decision;

    public ScoredCandidate winner() {
        return ranked.get(0);
    }
}
