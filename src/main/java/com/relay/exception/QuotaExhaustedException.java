package com.relay.exception;

import com.relay.service.quota.UpgradePrompt;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Instant-tier cap reached or every pool is exhausted. Recoverable by the user connecting their own key.
 */
@Getter
public class QuotaExhaustedException extends RelayException {

    private final transient UpgradePrompt upgradePrompt;

    public QuotaExhaustedException(String message, UpgradePrompt upgradePrompt) {
        super(message);
        this.upgradePrompt = upgradePrompt;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.TOO_MANY_REQUESTS;
    }

    @Override
    public String getCode() {
        return "quota_exhausted";
    }
}
