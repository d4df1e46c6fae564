package com.relay.service.monitoring;

import com.relay.config.RelayProperties;
import com.relay.model.routing.ExecutionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Decides which outcomes reach the accuracy pipeline.
 *
 * Failed and slow requests are always kept. Volume is measured as requests per second over a
 * sliding window.
 */
@Slf4j
@Component
public class SamplingPolicy {

    static final double MIN_ADAPTIVE_RATE = 0.1;

    private final RelayProperties.SamplingConfig config;
    private final Clock clock;
    private final DoubleSupplier random;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> window = new ArrayDeque<>();

    @Autowired
    public SamplingPolicy(RelayProperties properties, Clock clock) {
        this(properties.getMonitoring().getSampling(), clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    SamplingPolicy(RelayProperties.SamplingConfig config, Clock clock, DoubleSupplier random) {
        this.config = config;
        this.clock = clock;
        this.random = random;
    }

    public boolean shouldSample(ExecutionOutcome outcome) {
        double rps = recordAndMeasure();
        if (!outcome.isSuccess() || outcome.getLatencyMs() > config.getSlowRequestThresholdMs()) {
            return true;
        }
        double rate = rateFor(rps);
        boolean sampled = rate >= 1.0 || random.getAsDouble() < rate;
        if (!sampled) {
            log.trace("Outcome {} not sampled at rate {} ({} rps)", outcome.getRequestId(), rate, rps);
        }
        return sampled;
    }

    /**
     * Sampling rate at the given volume in requests per second.
     */
    double rateFor(double rps) {
        double base = config.getBaseRate();
        double threshold = config.getHighVolumeThreshold();
        return switch (config.getStrategy()) {
            case ADAPTIVE -> rps > threshold ? Math.max(MIN_ADAPTIVE_RATE, base * threshold / rps) : base;
            case TIERED -> tieredRate(rps, base);
            case UNIFORM -> base;
        };
    }

    private static double tieredRate(double rps, double base) {
        if (rps > 1000) {
            return 0.01;
        }
        if (rps > 500) {
            return 0.05;
        }
        if (rps > 100) {
            return 0.1;
        }
        return base;
    }

    /**
     * Current volume in requests per second over the window, without counting a new request.
     */
    public double currentRequestsPerSecond() {
        lock.lock();
        try {
            evict(clock.instant());
            return perSecond(window.size());
        } finally {
            lock.unlock();
        }
    }

    private double recordAndMeasure() {
        lock.lock();
        try {
            Instant now = clock.instant();
            window.addLast(now);
            evict(now);
            return perSecond(window.size());
        } finally {
            lock.unlock();
        }
    }

    private void evict(Instant now) {
        Instant cutoff = now.minus(config.getVolumeWindow());
        while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
            window.pollFirst();
        }
    }

    private double perSecond(int count) {
        double seconds = Math.max(1.0, config.getVolumeWindow().toMillis() / 1000.0);
        return count / seconds;
    }
}
