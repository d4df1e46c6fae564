package com.relay.config;

import com.relay.model.routing.OptimizationStrategy;
import com.relay.service.monitoring.SamplingStrategy;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for Relay.
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private List<PoolDefinition> pools = new ArrayList<>();
    private QuotaConfig quota = new QuotaConfig();
    private RoutingConfig routing = new RoutingConfig();
    private List<ModelDefinition> catalog = new ArrayList<>();
    private PredictionConfig prediction = new PredictionConfig();
    private MonitoringConfig monitoring = new MonitoringConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private ExperimentConfig experiments = new ExperimentConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        @ToString.Exclude
        private String apiKey;
    }

    /**
     * A shared credential with its own daily request budget.
     */
    @Data
    public static class PoolDefinition {
        private String poolId;
        private String provider;
        @ToString.Exclude
        private String apiKey;
        private long dailyLimit = 1000;
        private int priority = 5;
    }

    @Data
    public static class QuotaConfig {
        private int instantDailyLimit = 25;
        private double upgradePromptRatio = 0.8;
        private boolean scheduledReset = true;
    }

    @Data
    public static class RoutingConfig {
        private OptimizationStrategy defaultStrategy = OptimizationStrategy.BALANCED;
        private double costWeight = 0.3;
        private double latencyWeight = 0.3;
        private double qualityWeight = 0.4;
        private int decisionCacheSize = 10000;
        private Duration decisionRetention = Duration.ofHours(1);
        /** How long a decide-only reservation waits for its outcome before the unit goes back. */
        private Duration reservationTimeout = Duration.ofMinutes(10);
    }

    /**
     * Static price/latency/quality entry for one (provider, model).
     */
    @Data
    public static class ModelDefinition {
        private String provider;
        private String model;
        private double inputCostPer1k;
        private double outputCostPer1k;
        private long baseLatencyMs;
        private double latencyPerTokenMs;
        private double baselineQuality = 0.8;
        private Set<String> capabilities = new HashSet<>();
        private boolean streaming = true;
    }

    @Data
    public static class PredictionConfig {
        private double learningRate = 0.1;
        private int fullConfidenceSamples = 20;
        private double minCorrection = 0.25;
        private double maxCorrection = 4.0;
        private double driftPenalty = 0.5;
        private int driftRecoverySamples = 10;
        private int userHistorySize = 50;
        private int userPatternWindow = 10;
        private int minPatternRequests = 3;
        private int maxTrackedUsers = 10000;
        private Duration userRetention = Duration.ofDays(7);
    }

    @Data
    public static class MonitoringConfig {
        private boolean enabled = true;
        private double driftThreshold = 0.05;
        private double accuracyThreshold = 0.95;
        private double significanceThreshold = 0.95;
        private int minSampleSize = 10;
        private int recentWindowSize = 50;
        private int maxHistorySize = 1000;
        private int maxAlerts = 1000;
        private Duration alertCooldown = Duration.ofMinutes(5);
        private int queueCapacity = 10000;
        private double anomalyLatencyFactor = 3.0;
        private int outcomeCacheSize = 100000;
        private Duration outcomeRetention = Duration.ofHours(24);
        private SamplingConfig sampling = new SamplingConfig();
    }

    @Data
    public static class SamplingConfig {
        private SamplingStrategy strategy = SamplingStrategy.ADAPTIVE;
        private double baseRate = 1.0;
        private double highVolumeThreshold = 100;
        private long slowRequestThresholdMs = 5000;
        private Duration volumeWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ExperimentConfig {
        private boolean enabled = true;
        private Duration analysisInterval = Duration.ofMinutes(1);
        private int maxResults = 10000;
        private int retainedResults = 8000;
    }
}
