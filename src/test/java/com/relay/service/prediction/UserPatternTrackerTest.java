package com.relay.service.prediction;

import com.relay.config.RelayProperties;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.RoutingRequestFactory;
import com.relay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UserPatternTrackerTest {

    private static final ScoredCandidate CHEAP = candidate(ProviderType.ANTHROPIC, "claude-3-haiku-20240307", 0.001, 0);
    private static final ScoredCandidate DEAR = candidate(ProviderType.OPENAI, "gpt-4o", 0.004, 1);
    private static final List<ScoredCandidate> RANKED = List.of(CHEAP, DEAR);

    private MutableClock clock;
    private RelayProperties properties;
    private UserPatternTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-10T12:00:00Z");
        properties = new RelayProperties();
        tracker = new UserPatternTracker(properties, clock);
    }

    private static ScoredCandidate candidate(ProviderType provider, String model, double cost, int rank) {
        return new ScoredCandidate(CandidatePrediction.builder()
                .provider(provider)
                .model(model)
                .predictedCost(cost)
                .build(), 1.0 - rank * 0.1, rank);
    }

    private static RequestFeatures features(CapabilityClass capability, double complexity) {
        return RequestFeatures.builder().capability(capability).complexityScore(complexity).build();
    }

    private void record(String user, CapabilityClass capability, double complexity, ScoredCandidate chosen) {
        tracker.record(user, features(capability, complexity), chosen, RANKED);
    }

    @Nested
    @DisplayName("Pattern id")
    class PatternId {

        @Test
        @DisplayName("should stay empty below the minimum request count")
        void tooFew() {
            record("user-1", CapabilityClass.CODE, 0.9, CHEAP);
            record("user-1", CapabilityClass.CODE, 0.9, CHEAP);

            assertThat(tracker.patternId("user-1")).isEmpty();
        }

        @Test
        @DisplayName("should combine the dominant request type with complexity")
        void dominantType() {
            record("user-1", CapabilityClass.CODE, 0.8, CHEAP);
            record("user-1", CapabilityClass.CODE, 0.6, CHEAP);
            record("user-1", CapabilityClass.CHAT, 0.7, CHEAP);

            assertThat(tracker.patternId("user-1")).hasValue("code_complex");
        }

        @Test
        @DisplayName("should look only at the most recent window")
        void recentWindow() {
            properties.getPrediction().setUserPatternWindow(3);
            tracker = new UserPatternTracker(properties, clock);
            for (int i = 0; i < 5; i++) {
                record("user-1", CapabilityClass.CODE, 0.9, CHEAP);
            }
            for (int i = 0; i < 3; i++) {
                record("user-1", CapabilityClass.SUPPORT, 0.1, CHEAP);
            }

            assertThat(tracker.patternId("user-1")).hasValue("support_simple");
        }

        @Test
        @DisplayName("should break ties toward the first declared type")
        void tie() {
            properties.getPrediction().setMinPatternRequests(2);
            tracker = new UserPatternTracker(properties, clock);
            record("user-1", CapabilityClass.CODE, 0.2, CHEAP);
            record("user-1", CapabilityClass.CHAT, 0.2, CHEAP);

            assertThat(tracker.patternId("user-1")).hasValue("chat_simple");
        }
    }

    @Nested
    @DisplayName("Insights")
    class Insights {

        @Test
        @DisplayName("should summarize types, providers and savings")
        void summarizes() {
            record("user-1", CapabilityClass.CODE, 0.8, CHEAP);
            record("user-1", CapabilityClass.CODE, 0.4, CHEAP);
            record("user-1", CapabilityClass.ANALYSIS, 0.6, CHEAP);
            record("user-1", CapabilityClass.ANALYSIS, 0.2, DEAR);
            record("user-1", CapabilityClass.CODE, 0.5, DEAR);

            UserPatternInsights insights = tracker.analyze("user-1").orElseThrow();

            assertThat(insights.getRequestsTracked()).isEqualTo(5);
            assertThat(insights.getCommonRequestTypes())
                    .extracting(UserPatternInsights.TypeShare::getType)
                    .containsExactly(CapabilityClass.CODE, CapabilityClass.ANALYSIS);
            assertThat(insights.getCommonRequestTypes().get(0).getFrequency()).isCloseTo(0.6, within(1e-9));
            assertThat(insights.getPreferredProviders().get(0).getProvider()).isEqualTo(ProviderType.ANTHROPIC);
            assertThat(insights.getPreferredProviders().get(0).getShare()).isCloseTo(0.6, within(1e-9));
            assertThat(insights.getAverageComplexity()).isCloseTo(0.5, within(1e-9));
            // spent 3 * 0.001 + 2 * 0.004 = 0.011 against 5 * 0.004 = 0.020
            assertThat(insights.getCostSavingsPercent()).isCloseTo(45.0, within(1e-6));
            assertThat(insights.getPatternId()).isEqualTo("code_simple");
            assertThat(insights.getLastSeen()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should keep only the configured history per user")
        void boundedHistory() {
            properties.getPrediction().setUserHistorySize(4);
            tracker = new UserPatternTracker(properties, clock);
            for (int i = 0; i < 10; i++) {
                record("user-1", CapabilityClass.CHAT, 0.1, CHEAP);
            }

            assertThat(tracker.analyze("user-1").orElseThrow().getRequestsTracked()).isEqualTo(4);
        }

        @Test
        @DisplayName("should be empty for unknown users")
        void unknown() {
            assertThat(tracker.analyze("nobody")).isEmpty();
        }
    }

    @Test
    @DisplayName("should not track anonymous traffic")
    void anonymous() {
        record(RoutingRequestFactory.ANONYMOUS_USER, CapabilityClass.CHAT, 0.1, CHEAP);
        record(null, CapabilityClass.CHAT, 0.1, CHEAP);

        assertThat(tracker.trackedUsers()).isZero();
        assertThat(tracker.analyze(RoutingRequestFactory.ANONYMOUS_USER)).isEmpty();
    }

    @Test
    @DisplayName("should forget users idle past the retention window")
    void retention() {
        record("user-1", CapabilityClass.CHAT, 0.1, CHEAP);

        clock.advance(properties.getPrediction().getUserRetention().plus(Duration.ofMinutes(1)));

        assertThat(tracker.analyze("user-1")).isEmpty();
    }
}
