package com.relay.service.monitoring;

import com.relay.config.RelayProperties;
import com.relay.exception.ResourceNotFoundException;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import com.relay.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertManagerTest {

    private static final ModelKey KEY = ModelKey.of(ProviderType.ANTHROPIC, "claude-3-haiku-20240307");

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private RelayProperties properties;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-10T12:00:00Z");
        registry = new SimpleMeterRegistry();
        properties = new RelayProperties();
    }

    private AlertManager manager() {
        return new AlertManager(properties, clock, new RelayMetrics(registry));
    }

    @Nested
    @DisplayName("Cooldown")
    class Cooldown {

        @Test
        @DisplayName("should refresh the open alert inside the cooldown")
        void refreshInsideCooldown() {
            AlertManager manager = manager();
            Alert first = manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.MEDIUM, KEY, "at 90%", 0.9);

            clock.advance(Duration.ofMinutes(2));
            Alert second = manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.HIGH, KEY, "at 75%", 0.75);

            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(second.getOccurrences()).isEqualTo(2);
            assertThat(second.getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(second.getValue()).isEqualTo(0.75);
            assertThat(second.getMessage()).isEqualTo("at 75%");
            assertThat(second.getDuration()).isEqualTo(Duration.ofMinutes(2));
            assertThat(manager.getAlerts(false)).hasSize(1);
            assertThat(registry.counter("relay.monitoring.alerts",
                    "type", "accuracy_degradation", "severity", "medium").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep the higher severity when a lower one repeats")
        void severityNeverDrops() {
            AlertManager manager = manager();
            manager.raise(AlertType.DRIFT_DETECTED, AlertSeverity.CRITICAL, KEY, "drift", 0.2);

            Alert refreshed = manager.raise(AlertType.DRIFT_DETECTED, AlertSeverity.HIGH, KEY, "drift", 0.12);

            assertThat(refreshed.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        }

        @Test
        @DisplayName("should raise a new alert once the cooldown has passed")
        void newAfterCooldown() {
            AlertManager manager = manager();
            Alert first = manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.MEDIUM, KEY, "a", 0.9);

            clock.advance(Duration.ofMinutes(6));
            Alert second = manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.MEDIUM, KEY, "b", 0.9);

            assertThat(second.getId()).isNotEqualTo(first.getId());
            assertThat(manager.getAlerts(false)).hasSize(2);
        }

        @Test
        @DisplayName("should scope the cooldown by type and model")
        void scoped() {
            AlertManager manager = manager();
            manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.MEDIUM, KEY, "a", 0.9);
            manager.raise(AlertType.PERFORMANCE_ANOMALY, AlertSeverity.MEDIUM, KEY, "b", 4.0);
            manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.MEDIUM,
                    ModelKey.of(ProviderType.OPENAI, "gpt-4o"), "c", 0.9);

            assertThat(manager.getAlerts(false)).hasSize(3);
            assertThat(manager.count(AlertType.ACCURACY_DEGRADATION)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("should mark an alert resolved and open a new one on the next trigger")
        void resolve() {
            AlertManager manager = manager();
            Alert alert = manager.raise(AlertType.DRIFT_DETECTED, AlertSeverity.HIGH, KEY, "drift", 0.12);

            Alert resolved = manager.resolve(alert.getId());
            Alert next = manager.raise(AlertType.DRIFT_DETECTED, AlertSeverity.HIGH, KEY, "drift", 0.12);

            assertThat(resolved.isResolved()).isTrue();
            assertThat(resolved.getResolvedAt()).isEqualTo(clock.instant());
            assertThat(next.getId()).isNotEqualTo(alert.getId());
            assertThat(manager.getAlerts(true)).extracting(Alert::getId).containsExactly(next.getId());
        }

        @Test
        @DisplayName("should reject unknown alert ids")
        void unknown() {
            assertThatThrownBy(() -> manager().resolve("alert_missing"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("should trim to half the capacity when full")
    void trim() {
        properties.getMonitoring().setMaxAlerts(4);
        AlertManager manager = manager();

        for (int i = 0; i < 5; i++) {
            manager.raise(AlertType.PERFORMANCE_ANOMALY, AlertSeverity.MEDIUM,
                    ModelKey.of(ProviderType.LOCAL, "model-" + i), "slow", 4.0);
        }

        assertThat(manager.getAlerts(false)).extracting(Alert::getModel).containsExactly("model-3", "model-4");
    }

    @Test
    @DisplayName("should count alerts by type and severity")
    void summary() {
        AlertManager manager = manager();
        manager.raise(AlertType.ACCURACY_DEGRADATION, AlertSeverity.HIGH, KEY, "a", 0.7);
        manager.raise(AlertType.DRIFT_DETECTED, AlertSeverity.CRITICAL, KEY, "b", 0.3);

        assertThat(manager.summary())
                .containsEntry("accuracy_degradation_high", 1L)
                .containsEntry("drift_detected_critical", 1L)
                .hasSize(2);
    }
}
