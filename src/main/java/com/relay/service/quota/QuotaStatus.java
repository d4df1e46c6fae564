package com.relay.service.quota;

import lombok.Builder;
import lombok.Value;

/**
 * Quota view for UI collaborators.
 */
@Value
@Builder
public class QuotaStatus {

    String userId;
    UserTier tier;
    long requestsToday;
    /** Null when the tier is uncapped. */
    Long remaining;
    PoolSummary poolStatus;

    @Value
    public static class PoolSummary {
        int totalPools;
        int availablePools;
    }
}
