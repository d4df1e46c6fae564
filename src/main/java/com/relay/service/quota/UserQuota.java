package com.relay.service.quota;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-user daily counter. Guarded by the {@link QuotaPoolManager} lock.
 */
@Getter
@ToString
public class UserQuota {

    private final String userId;
    private long requestsToday;
    private UserTier tier = UserTier.INSTANT;
    private Instant lastRequest;
    private LocalDate day;

    UserQuota(String userId, LocalDate day) {
        this.userId = userId;
        this.day = day;
    }

    void rollOver(LocalDate today) {
        if (day.isBefore(today)) {
            requestsToday = 0;
            day = today;
        }
    }

    void consume(long units, Instant now) {
        requestsToday += units;
        lastRequest = now;
    }

    void refund(long units) {
        requestsToday = Math.max(0, requestsToday - units);
    }

    void setTier(UserTier tier) {
        this.tier = tier;
    }
}
