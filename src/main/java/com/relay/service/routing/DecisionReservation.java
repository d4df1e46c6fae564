package com.relay.service.routing;

import com.relay.model.routing.RoutingDecision;
import lombok.Value;

/**
 * A decide-only result: the decision and the pool capacity reserved for the external dispatcher.
 */
@Value
public class DecisionReservation {

    RoutingDecision decision;
    String poolId;
    Long quotaRemaining;
}
