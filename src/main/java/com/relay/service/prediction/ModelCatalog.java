package com.relay.service.prediction;

import com.relay.config.RelayProperties;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.relay.model.routing.CapabilityClass.ANALYSIS;
import static com.relay.model.routing.CapabilityClass.CHAT;
import static com.relay.model.routing.CapabilityClass.CODE;
import static com.relay.model.routing.CapabilityClass.CREATIVE;
import static com.relay.model.routing.CapabilityClass.SUPPORT;
import static com.relay.model.routing.CapabilityClass.TOOLS;

/**
 * Per-(provider, model) price/latency/quality table. Loaded from {@code relay.catalog}, or the built-in
 * defaults when none is configured.
 */
@Slf4j
@Component
public class ModelCatalog {

    private final Map<ModelKey, ModelProfile> profiles;

    @Autowired
    public ModelCatalog(RelayProperties properties) {
        this(properties.getCatalog().isEmpty() ? defaults() : fromDefinitions(properties.getCatalog()));
    }

    public ModelCatalog(List<ModelProfile> entries) {
        Map<ModelKey, ModelProfile> map = new LinkedHashMap<>();
        for (ModelProfile profile : entries) {
            map.put(profile.key(), profile);
        }
        this.profiles = Collections.unmodifiableMap(map);
        log.info("Model catalog loaded with {} entries", profiles.size());
    }

    public List<ModelProfile> all() {
        return List.copyOf(profiles.values());
    }

    public Optional<ModelProfile> find(ModelKey key) {
        return Optional.ofNullable(profiles.get(key));
    }

    public Optional<ModelProfile> find(ProviderType provider, String model) {
        return find(ModelKey.of(provider, model));
    }

    /**
     * Entries matching a model hint: an exact model name, a provider name, or a model family prefix.
     */
    public List<ModelProfile> matchingHint(String hint) {
        String normalized = hint.trim().toLowerCase(Locale.ROOT);
        List<ModelProfile> exact = profiles.values().stream()
                .filter(p -> p.getModel().equalsIgnoreCase(normalized))
                .toList();
        if (!exact.isEmpty()) {
            return exact;
        }
        return profiles.values().stream()
                .filter(p -> p.getProvider().id().equals(normalized)
                        || ("ollama".equals(normalized) && p.getProvider() == ProviderType.LOCAL)
                        || p.getModel().toLowerCase(Locale.ROOT).startsWith(normalized))
                .toList();
    }

    public List<ModelProfile> supporting(CapabilityClass capability) {
        return profiles.values().stream().filter(p -> p.supports(capability)).toList();
    }

    static List<ModelProfile> fromDefinitions(List<RelayProperties.ModelDefinition> definitions) {
        List<ModelProfile> result = new ArrayList<>();
        for (RelayProperties.ModelDefinition definition : definitions) {
            Set<CapabilityClass> capabilities = EnumSet.noneOf(CapabilityClass.class);
            definition.getCapabilities().forEach(c -> capabilities.add(CapabilityClass.fromString(c)));
            if (capabilities.isEmpty()) {
                capabilities.add(CHAT);
            }
            result.add(ModelProfile.builder()
                    .provider(ProviderType.fromString(definition.getProvider()))
                    .model(definition.getModel())
                    .inputCostPer1k(definition.getInputCostPer1k())
                    .outputCostPer1k(definition.getOutputCostPer1k())
                    .baseLatencyMs(definition.getBaseLatencyMs())
                    .latencyPerTokenMs(definition.getLatencyPerTokenMs())
                    .baselineQuality(definition.getBaselineQuality())
                    .capabilities(capabilities)
                    .streaming(definition.isStreaming())
                    .build());
        }
        return result;
    }

    static List<ModelProfile> defaults() {
        return List.of(
                profile(ProviderType.OPENAI, "gpt-4o", 0.0025, 0.01, 2000, 4, 0.9,
                        EnumSet.allOf(CapabilityClass.class)),
                profile(ProviderType.OPENAI, "gpt-4o-mini", 0.00015, 0.0006, 2000, 2, 0.8,
                        EnumSet.allOf(CapabilityClass.class)),
                profile(ProviderType.OPENAI, "gpt-3.5-turbo", 0.0005, 0.0015, 2000, 2, 0.75,
                        EnumSet.of(CHAT, SUPPORT, CREATIVE, TOOLS)),
                profile(ProviderType.ANTHROPIC, "claude-3-5-sonnet-20241022", 0.003, 0.015, 2500, 5, 0.95,
                        EnumSet.allOf(CapabilityClass.class)),
                profile(ProviderType.ANTHROPIC, "claude-3-haiku-20240307", 0.00025, 0.00125, 2500, 2, 0.85,
                        EnumSet.of(CHAT, SUPPORT, CREATIVE, CODE, TOOLS)),
                profile(ProviderType.GOOGLE, "gemini-1.5-pro", 0.00125, 0.005, 1800, 4, 0.85,
                        EnumSet.allOf(CapabilityClass.class)),
                profile(ProviderType.GOOGLE, "gemini-1.5-flash", 0.000075, 0.0003, 1800, 1.5, 0.8,
                        EnumSet.of(CHAT, SUPPORT, CREATIVE, ANALYSIS, TOOLS)),
                profile(ProviderType.LOCAL, "llama3.1", 0.0, 0.0, 500, 8, 0.7,
                        EnumSet.of(CHAT, SUPPORT, CREATIVE, CODE)));
    }

    private static ModelProfile profile(ProviderType provider, String model, double in, double out,
                                        long baseLatency, double perToken, double quality,
                                        Set<CapabilityClass> capabilities) {
        return ModelProfile.builder()
                .provider(provider)
                .model(model)
                .inputCostPer1k(in)
                .outputCostPer1k(out)
                .baseLatencyMs(baseLatency)
                .latencyPerTokenMs(perToken)
                .baselineQuality(quality)
                .capabilities(capabilities)
                .streaming(true)
                .build();
    }
}
