package com.relay.service.quota;

import com.relay.config.RelayProperties;
import com.relay.service.monitoring.RelayMetrics;
import com.relay.support.MutableClock;
import com.relay.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.relay.support.TestProperties.pool;
import static org.assertj.core.api.Assertions.assertThat;

class DailyResetSchedulerTest {

    private DailyResetScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    @Test
    @DisplayName("should compute the delay until the next UTC midnight")
    void shouldComputeDelayUntilMidnight() {
        assertThat(DailyResetScheduler.delayUntilNextMidnight(Instant.parse("2024-03-10T23:00:00Z")))
                .isEqualTo(Duration.ofHours(1));
        assertThat(DailyResetScheduler.delayUntilNextMidnight(Instant.parse("2024-03-10T12:30:00Z")))
                .isEqualTo(Duration.ofHours(11).plusMinutes(30));
        assertThat(DailyResetScheduler.delayUntilNextMidnight(Instant.parse("2024-03-11T00:00:00Z")))
                .isEqualTo(Duration.ofDays(1));
    }

    @Test
    @DisplayName("firing after midnight resets counters and re-arms the timer")
    void firingShouldResetAndRearm() {
        MutableClock clock = MutableClock.at("2024-03-10T22:00:00Z");
        RelayProperties properties = TestProperties.withPools(pool("p", "openai", 2, 1));
        QuotaPoolManager manager = new QuotaPoolManager(properties, clock, new RelayMetrics(new SimpleMeterRegistry()));
        manager.getAvailableKey("u1", null, 2);
        scheduler = new DailyResetScheduler(manager, clock, properties);

        clock.set(Instant.parse("2024-03-11T00:00:00.010Z"));
        scheduler.fire();

        assertThat(manager.getPoolStatus().getPools().get(0).getUsedToday()).isZero();
        assertThat(manager.getPoolStatus().getPools().get(0).getStatus()).isEqualTo(PoolStatus.ACTIVE);
        assertThat(scheduler.isArmed()).isTrue();
    }

    @Test
    @DisplayName("firing twice on the same day resets only once")
    void firingTwiceIsIdempotent() {
        MutableClock clock = MutableClock.at("2024-03-11T00:00:00Z");
        RelayProperties properties = TestProperties.withPools(pool("p", "openai", 5, 1));
        QuotaPoolManager manager = new QuotaPoolManager(properties, clock, new RelayMetrics(new SimpleMeterRegistry()));
        scheduler = new DailyResetScheduler(manager, clock, properties);

        scheduler.fire();
        manager.getAvailableKey("u1");
        scheduler.fire();

        assertThat(manager.getPoolStatus().getPools().get(0).getUsedToday()).isEqualTo(1);
    }
}
