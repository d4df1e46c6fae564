package com.relay.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.Usage;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.ScoredCandidate;
import com.relay.model.routing.Variant;
import com.relay.service.routing.RoutedCompletion;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response of the routing endpoint: the content plus a readable account of the decision.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutingResponse {

    String requestId;
    ProviderType provider;
    String model;
    String content;
    UsageSummary usage;
    DecisionSummary routingDecision;
    Long quotaRemaining;

    @Value
    public static class UsageSummary {
        Integer promptTokens;
        Integer completionTokens;
        Double cost;
    }

    @Value
    @Builder
    public static class DecisionSummary {
        String strategy;
        String reasoning;
        boolean fallback;
        List<ProviderType> attemptedProviders;
        List<Alternative> alternatives;
        String experimentId;
        Variant variant;
    }

    @Value
    public static class Alternative {
        int rank;
        ProviderType provider;
        String model;
        double score;
        double predictedCost;
        long predictedLatencyMs;
        double predictedQuality;
        double confidence;

        static Alternative of(ScoredCandidate candidate) {
            CandidatePrediction p = candidate.getPrediction();
            return new Alternative(candidate.getRank(), p.getProvider(), p.getModel(), candidate.getScore(),
                    p.getPredictedCost(), p.getPredictedLatencyMs(), p.getPredictedQuality(), p.getConfidence());
        }
    }

    public static RoutingResponse from(RoutedCompletion completion) {
        ChatCompletionResponse response = completion.getResponse();
        RoutingDecision decision = completion.getDecision();
        Usage usage = response.getUsage();
        return RoutingResponse.builder()
                .requestId(decision.getRequestId())
                .provider(decision.getProvider())
                .model(decision.getModel())
                .content(response.firstContent())
                .usage(usage != null
                        ? new UsageSummary(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getCost())
                        : null)
                .routingDecision(summarize(decision))
                .quotaRemaining(completion.getQuotaRemaining())
                .build();
    }

    public static DecisionSummary summarize(RoutingDecision decision) {
        List<ScoredCandidate> ranked = decision.getAlternatives() != null ? decision.getAlternatives() : List.of();
        return DecisionSummary.builder()
                .strategy(decision.getStrategy() != null ? decision.getStrategy().name().toLowerCase() : null)
                .reasoning(decision.getReasoning())
                .fallback(decision.isFallback())
                .attemptedProviders(decision.getAttemptedProviders())
                .alternatives(ranked.stream().map(Alternative::of).toList())
                .experimentId(decision.getExperimentId())
                .variant(decision.getVariant())
                .build();
    }
}
