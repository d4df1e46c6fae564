package com.relay.service.monitoring;

import com.relay.config.RelayProperties;
import com.relay.exception.ResourceNotFoundException;
import com.relay.model.routing.ModelKey;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded alert feed with a per-(type, provider, model) cooldown.
 */
@Slf4j
@Component
public class AlertManager {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Alert> alerts = new ArrayList<>();
    private final Map<CooldownKey, String> lastAlertIds = new HashMap<>();
    private final Clock clock;
    private final RelayMetrics metrics;
    private final Duration cooldown;
    private final int maxAlerts;

    public AlertManager(RelayProperties properties, Clock clock, RelayMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
        this.cooldown = properties.getMonitoring().getAlertCooldown();
        this.maxAlerts = Math.max(2, properties.getMonitoring().getMaxAlerts());
    }

    /**
     * Raise an alert, or refresh the open one for the same scope if it is still inside the cooldown.
     */
    public Alert raise(AlertType type, AlertSeverity severity, ModelKey key, String message, double value) {
        Instant now = clock.instant();
        CooldownKey cooldownKey = new CooldownKey(type, key);
        lock.lock();
        try {
            String lastId = lastAlertIds.get(cooldownKey);
            int index = lastId != null ? indexOf(lastId) : -1;
            if (index >= 0) {
                Alert existing = alerts.get(index);
                if (!existing.isResolved() && Duration.between(existing.getRaisedAt(), now).compareTo(cooldown) < 0) {
                    Alert refreshed = existing.toBuilder()
                            .value(value)
                            .message(message)
                            .severity(severity.compareTo(existing.getSeverity()) > 0 ? severity : existing.getSeverity())
                            .lastTriggeredAt(now)
                            .duration(Duration.between(existing.getRaisedAt(), now))
                            .occurrences(existing.getOccurrences() + 1)
                            .build();
                    alerts.set(index, refreshed);
                    log.debug("Alert {} refreshed inside cooldown: {}", existing.getId(), message);
                    return refreshed;
                }
            }

            Alert alert = Alert.builder()
                    .id("alert_" + UUID.randomUUID().toString().substring(0, 12))
                    .type(type)
                    .severity(severity)
                    .provider(key.getProvider())
                    .model(key.getModel())
                    .message(message)
                    .value(value)
                    .raisedAt(now)
                    .lastTriggeredAt(now)
                    .duration(Duration.ZERO)
                    .occurrences(1)
                    .build();
            alerts.add(alert);
            lastAlertIds.put(cooldownKey, alert.getId());
            if (alerts.size() > maxAlerts) {
                alerts.subList(0, alerts.size() - maxAlerts / 2).clear();
            }
            metrics.recordAlert(type, severity);
            log.warn("Monitoring alert [{}] {} for {}: {}", severity, type, key, message);
            return alert;
        } finally {
            lock.unlock();
        }
    }

    public List<Alert> getAlerts(boolean unresolvedOnly) {
        lock.lock();
        try {
            return alerts.stream()
                    .filter(alert -> !unresolvedOnly || !alert.isResolved())
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public Alert resolve(String alertId) {
        lock.lock();
        try {
            int index = indexOf(alertId);
            if (index < 0) {
                throw new ResourceNotFoundException("Alert not found: " + alertId);
            }
            Alert alert = alerts.get(index);
            if (alert.isResolved()) {
                return alert;
            }
            Alert resolved = alert.toBuilder().resolved(true).resolvedAt(clock.instant()).build();
            alerts.set(index, resolved);
            log.info("Alert {} resolved", alertId);
            return resolved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Alert counts keyed by {@code type_severity}.
     */
    public Map<String, Long> summary() {
        lock.lock();
        try {
            Map<String, Long> counts = new TreeMap<>();
            for (Alert alert : alerts) {
                counts.merge(alert.getType().name().toLowerCase() + "_" + alert.getSeverity().name().toLowerCase(),
                        1L, Long::sum);
            }
            return counts;
        } finally {
            lock.unlock();
        }
    }

    public long count(AlertType type) {
        lock.lock();
        try {
            return alerts.stream().filter(alert -> alert.getType() == type).count();
        } finally {
            lock.unlock();
        }
    }

    private int indexOf(String alertId) {
        for (int i = alerts.size() - 1; i >= 0; i--) {
            if (Objects.equals(alerts.get(i).getId(), alertId)) {
                return i;
            }
        }
        return -1;
    }

    @Value
    private static class CooldownKey {
        AlertType type;
        ModelKey key;
    }
}
