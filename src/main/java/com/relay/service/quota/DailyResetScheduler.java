package com.relay.service.quota;

import com.relay.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fires the daily quota reset at each UTC midnight. Single-fire timer, re-armed after every run
 * from the injected clock, so it never accumulates drift.
 */
@Slf4j
@Component
public class DailyResetScheduler {

    private final QuotaPoolManager quotaPoolManager;
    private final Clock clock;
    private final boolean enabled;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "relay-quota-reset");
        thread.setDaemon(true);
        return thread;
    });

    private volatile ScheduledFuture<?> next;

    public DailyResetScheduler(QuotaPoolManager quotaPoolManager, Clock clock, RelayProperties properties) {
        this.quotaPoolManager = quotaPoolManager;
        this.clock = clock;
        this.enabled = properties.getQuota().isScheduledReset();
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Scheduled quota reset disabled; relying on lazy rollover");
            return;
        }
        scheduleNext();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * Run one reset and arm the timer for the following midnight.
     */
    void fire() {
        try {
            boolean reset = quotaPoolManager.resetIfNewDay();
            log.debug("Scheduled quota reset fired, reset={}", reset);
        } catch (RuntimeException e) {
            log.error("Scheduled quota reset failed", e);
        } finally {
            if (enabled && !scheduler.isShutdown()) {
                scheduleNext();
            }
        }
    }

    private void scheduleNext() {
        Duration delay = delayUntilNextMidnight(clock.instant());
        next = scheduler.schedule(this::fire, delay.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Next quota reset in {}", delay);
    }

    /**
     * Time from {@code now} to the next UTC midnight. Exactly at midnight this is a full day.
     */
    static Duration delayUntilNextMidnight(Instant now) {
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        Instant nextMidnight = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return Duration.between(now, nextMidnight);
    }

    boolean isArmed() {
        ScheduledFuture<?> future = next;
        return future != null && !future.isDone();
    }
}
