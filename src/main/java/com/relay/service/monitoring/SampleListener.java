package com.relay.service.monitoring;

import com.relay.model.routing.RoutingDecision;

/**
 * Notified on the monitor's worker after a successful outcome has been paired with its prediction.
 */
@FunctionalInterface
public interface SampleListener {

    void onSample(RoutingDecision decision, PredictionSample sample);
}
