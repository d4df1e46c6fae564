package com.relay.controller;

import com.relay.exception.GlobalExceptionHandler;
import com.relay.model.routing.ProviderType;
import com.relay.service.monitoring.RelayMetrics;
import com.relay.service.quota.QuotaPoolManager;
import com.relay.support.MutableClock;
import com.relay.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.relay.support.TestProperties.pool;

class QuotaControllerTest {

    private QuotaPoolManager quotaPoolManager;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        quotaPoolManager = new QuotaPoolManager(
                TestProperties.withPools(pool("google-1", "google", 1500, 1), pool("openai-1", "openai", 10, 2)),
                MutableClock.at("2024-03-10T12:00:00Z"),
                new RelayMetrics(new SimpleMeterRegistry()));
        client = WebTestClient.bindToController(new QuotaController(quotaPoolManager))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private void use(String userId, int requests) {
        for (int i = 0; i < requests; i++) {
            quotaPoolManager.getAvailableKey(userId, ProviderType.GOOGLE, 1);
        }
    }

    @Test
    @DisplayName("should report the instant-tier allowance for a new user")
    void statusForNewUser() {
        client.get().uri("/v1/quota/user-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tier").isEqualTo("INSTANT")
                .jsonPath("$.requestsToday").isEqualTo(0)
                .jsonPath("$.remaining").isEqualTo(25)
                .jsonPath("$.poolStatus.totalPools").isEqualTo(2)
                .jsonPath("$.poolStatus.availablePools").isEqualTo(2);
    }

    @Test
    @DisplayName("should drop the cap when the tier is upgraded")
    void upgradesTier() {
        use("user-1", 3);

        client.put().uri("/v1/quota/user-1/tier")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tier\":\"connected\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tier").isEqualTo("CONNECTED")
                .jsonPath("$.requestsToday").isEqualTo(3)
                .jsonPath("$.remaining").doesNotExist();
    }

    @Test
    @DisplayName("should reject unknown tiers")
    void rejectsUnknownTier() {
        client.put().uri("/v1/quota/user-1/tier")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tier\":\"platinum\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unknown tier: platinum");
    }

    @Test
    @DisplayName("should answer 204 until the user nears the cap")
    void noPromptYet() {
        use("user-1", 5);

        client.get().uri("/v1/quota/user-1/upgrade-prompt")
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    @DisplayName("should return an urgent prompt near the cap")
    void promptNearCap() {
        use("user-1", 21);

        client.get().uri("/v1/quota/user-1/upgrade-prompt")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.title").isEqualTo("Only 4 requests left today")
                .jsonPath("$.urgency").isEqualTo("HIGH");
    }

    @Test
    @DisplayName("should list pool usage")
    void listsPools() {
        use("user-1", 2);

        client.get().uri("/v1/quota/pools")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.pools.length()").isEqualTo(2)
                .jsonPath("$.pools[0].poolId").isEqualTo("google-1")
                .jsonPath("$.pools[0].usedToday").isEqualTo(2)
                .jsonPath("$.pools[0].status").isEqualTo("ACTIVE")
                .jsonPath("$.totalUsers").isEqualTo(1)
                .jsonPath("$.totalRequestsToday").isEqualTo(2);
    }
}
