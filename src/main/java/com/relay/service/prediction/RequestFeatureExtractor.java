package com.relay.service.prediction;

import com.relay.model.Message;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Deterministic, side-effect free feature extraction from a routing request.
 */
@Component
public class RequestFeatureExtractor {

    static final int CHARS_PER_TOKEN = 4;
    static final int MIN_COMPLETION_TOKENS = 100;
    static final int MAX_COMPLETION_TOKENS = 1000;

    public RequestFeatures extract(RoutingRequest request) {
        int promptTokens = 0;
        int totalChars = 0;
        boolean hasSystem = false;
        StringBuilder text = new StringBuilder();

        for (Message message : request.getMessages()) {
            String content = message.getContent() != null ? message.getContent() : "";
            totalChars += content.length();
            promptTokens += estimateTokens(content);
            hasSystem |= message.isSystem();
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(content);
        }

        String lower = text.toString().toLowerCase(Locale.ROOT);
        CapabilityClass capability = request.getCapability();
        boolean explicit = capability != null;
        if (!explicit) {
            capability = request.isHasTools() ? CapabilityClass.TOOLS : classify(lower);
        }

        return RequestFeatures.builder()
                .promptTokens(promptTokens)
                .estimatedCompletionTokens(estimateCompletionTokens(request.getMaxTokens(), promptTokens))
                .messageCount(request.getMessages().size())
                .totalChars(totalChars)
                .hasSystemMessage(hasSystem)
                .hasTools(request.isHasTools())
                .complexityScore(complexity(request, lower))
                .capability(capability)
                .capabilityExplicit(explicit)
                .build();
    }

    static int estimateTokens(String content) {
        return (content.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    static int estimateCompletionTokens(Integer maxTokens, int promptTokens) {
        if (maxTokens != null && maxTokens > 0) {
            return maxTokens;
        }
        return Math.max(MIN_COMPLETION_TOKENS, Math.min(MAX_COMPLETION_TOKENS, promptTokens));
    }

    static CapabilityClass classify(String text) {
        if (containsAny(text, "code", "function", "programming")) {
            return CapabilityClass.CODE;
        }
        if (containsAny(text, "analyze", "data", "report")) {
            return CapabilityClass.ANALYSIS;
        }
        if (containsAny(text, "write", "story", "creative")) {
            return CapabilityClass.CREATIVE;
        }
        if (containsAny(text, "help", "support", "problem")) {
            return CapabilityClass.SUPPORT;
        }
        if (containsAny(text, "complex", "difficult") || text.length() > 500) {
            return CapabilityClass.ANALYSIS;
        }
        return CapabilityClass.CHAT;
    }

    private static double complexity(RoutingRequest request, String text) {
        double score = request.getMessages().size() * 0.1;
        if (request.getMaxTokens() != null) {
            score += request.getMaxTokens() / 1000.0;
        }
        if (request.isHasTools()) {
            score += 1.0;
        }
        if (containsAny(text, "analyze", "compare")) {
            score += 0.3;
        }
        if (containsAny(text, "code", "function")) {
            score += 0.4;
        }
        if (containsAny(text, "explain", "detail")) {
            score += 0.2;
        }
        if (text.length() > 1000) {
            score += 0.3;
        }
        return Math.min(1.0, score);
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
