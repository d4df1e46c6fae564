package com.relay.service.monitoring;

import com.relay.model.routing.ProviderType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A monitoring alert scoped to one (provider, model). Repeated triggers inside the cooldown
 * refresh {@code value}, {@code lastTriggeredAt} and {@code duration} instead of creating a new alert.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    String id;
    AlertType type;
    AlertSeverity severity;
    ProviderType provider;
    String model;
    String message;

    /** The measurement that triggered the alert, e.g. overall accuracy or drift magnitude. */
    double value;

    Instant raisedAt;
    Instant lastTriggeredAt;
    Duration duration;
    int occurrences;

    boolean resolved;
    Instant resolvedAt;
}
