package com.relay.controller;

import com.relay.model.dto.TierUpdate;
import com.relay.service.quota.PoolSnapshot;
import com.relay.service.quota.QuotaPoolManager;
import com.relay.service.quota.QuotaStatus;
import com.relay.service.quota.UpgradePrompt;
import com.relay.service.quota.UserTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Quota status, tier management and pool health.
 */
@Slf4j
@RestController
@RequestMapping("/v1/quota")
public class QuotaController {

    private final QuotaPoolManager quotaPoolManager;

    public QuotaController(QuotaPoolManager quotaPoolManager) {
        this.quotaPoolManager = quotaPoolManager;
    }

    @GetMapping("/pools")
    public ResponseEntity<PoolSnapshot.Report> getPools() {
        return ResponseEntity.ok(quotaPoolManager.getPoolStatus());
    }

    @GetMapping("/{userId}")
    public ResponseEntity<QuotaStatus> getStatus(@PathVariable String userId) {
        return ResponseEntity.ok(quotaPoolManager.getQuotaStatus(userId));
    }

    @PutMapping("/{userId}/tier")
    public ResponseEntity<QuotaStatus> updateTier(@PathVariable String userId, @RequestBody TierUpdate update) {
        UserTier tier = UserTier.fromString(update.getTier());
        log.info("Admin: setting tier of {} to {}", userId, tier);
        quotaPoolManager.updateUserTier(userId, tier);
        return ResponseEntity.ok(quotaPoolManager.getQuotaStatus(userId));
    }

    /**
     * The prompt to show right now, or 204 when none applies.
     */
    @GetMapping("/{userId}/upgrade-prompt")
    public ResponseEntity<UpgradePrompt> getUpgradePrompt(@PathVariable String userId) {
        return quotaPoolManager.getUpgradePrompt(userId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }
}
