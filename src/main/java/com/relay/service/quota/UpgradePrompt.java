package com.relay.service.quota;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured prompt rendered directly by UI collaborators when a user runs out of shared quota.
 */
@Value
@Builder
public class UpgradePrompt {

    String title;
    String message;
    Urgency urgency;
    List<String> benefits;

    /**
     * Prompt sized by how many instant-tier requests remain today.
     */
    public static UpgradePrompt forRemaining(int remaining) {
        if (remaining <= 0) {
            return UpgradePrompt.builder()
                    .title("Daily limit reached")
                    .message("Connect your provider for 1,500+ daily requests")
                    .urgency(Urgency.CRITICAL)
                    .benefits(List.of(
                            "60x more requests (1,500+ vs 25)",
                            "Priority processing",
                            "No sharing with others",
                            "Advanced orchestration features"))
                    .build();
        }
        if (remaining <= 5) {
            return UpgradePrompt.builder()
                    .title("Only " + remaining + " requests left today")
                    .message("Connect your provider for unlimited requests")
                    .urgency(Urgency.HIGH)
                    .benefits(List.of("60x more requests", "Priority processing", "Dedicated quota"))
                    .build();
        }
        return UpgradePrompt.builder()
                .title(remaining + " requests left today")
                .message("Connect your provider to remove the shared daily cap")
                .urgency(Urgency.MEDIUM)
                .benefits(List.of("60x more requests", "Dedicated quota"))
                .build();
    }

    public static UpgradePrompt poolsExhausted() {
        return UpgradePrompt.builder()
                .title("Shared capacity exhausted")
                .message("Connect your provider to continue instantly")
                .urgency(Urgency.CRITICAL)
                .benefits(List.of("60x more requests", "Priority processing", "Advanced features"))
                .build();
    }
}
