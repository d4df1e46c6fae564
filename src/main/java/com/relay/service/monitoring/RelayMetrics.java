package com.relay.service.monitoring;

import com.relay.model.routing.ErrorKind;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for routing, quota, streaming and the accuracy pipeline.
 * Exposed through the actuator Prometheus endpoint.
 */
@Slf4j
@Component
public class RelayMetrics {

    private static final String PREFIX = "relay";

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(ProviderType provider, String model, OptimizationStrategy strategy) {
        Counter.builder(PREFIX + ".routing.decisions")
                .description("Routing decisions by chosen provider and model")
                .tag("provider", provider.id())
                .tag("model", model)
                .tag("strategy", strategy.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordFallback(ProviderType from, ProviderType to) {
        Counter.builder(PREFIX + ".routing.fallbacks")
                .tag("from", from.id())
                .tag("to", to.id())
                .register(registry)
                .increment();
    }

    public void recordDispatchFailure(ProviderType provider, ErrorKind kind) {
        Counter.builder(PREFIX + ".dispatch.failures")
                .tag("provider", provider.id())
                .tag("kind", kind.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordDispatchLatency(ProviderType provider, Duration latency) {
        Timer.builder(PREFIX + ".dispatch.latency")
                .description("Provider dispatch latency")
                .tag("provider", provider.id())
                .register(registry)
                .record(latency);
    }

    public void recordQuotaDenial(String reason) {
        Counter.builder(PREFIX + ".quota.denials")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordMalformedFrame(ProviderType provider) {
        Counter.builder(PREFIX + ".stream.malformed_frames")
                .tag("provider", provider.id())
                .register(registry)
                .increment();
    }

    public void recordDroppedSample() {
        Counter.builder(PREFIX + ".monitoring.dropped_samples")
                .register(registry)
                .increment();
    }

    public void recordAlert(AlertType type, AlertSeverity severity) {
        Counter.builder(PREFIX + ".monitoring.alerts")
                .tag("type", type.name().toLowerCase())
                .tag("severity", severity.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void registerQueueGauge(Supplier<Number> queueSize) {
        Gauge.builder(PREFIX + ".monitoring.queue_size", queueSize)
                .description("Outcomes waiting for accuracy processing")
                .register(registry);
        log.debug("Registered monitoring queue gauge");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
