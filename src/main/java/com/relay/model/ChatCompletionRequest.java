package com.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * OpenAI-compatible chat completion request, extended with optional routing hints.
 * The {@code model} field is a hint: "auto" or null lets the router pick freely.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("stop")
    private Object stop; // Can be String or List<String>

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("user")
    private String user;

    @JsonProperty("tools")
    private List<Object> tools;

    @JsonProperty("tool_choice")
    private Object toolChoice;

    // Routing hints, never forwarded upstream

    @JsonProperty("optimize_for")
    private String optimizeFor; // cost, speed, quality, balanced

    @JsonProperty("capability")
    private String capability;

    @JsonProperty("constraints")
    private Constraints constraints;

    /**
     * Hard routing constraints as they arrive on the wire.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Constraints {

        @JsonProperty("max_cost")
        private Double maxCost;

        @JsonProperty("min_quality")
        private Double minQuality;

        @JsonProperty("max_response_time_ms")
        private Long maxResponseTimeMs;

        @JsonProperty("preferred_providers")
        private Set<String> preferredProviders;

        @JsonProperty("exclude_providers")
        private Set<String> excludeProviders;
    }

    /**
     * Copy suitable for an upstream provider: concrete model, routing hints stripped.
     */
    public ChatCompletionRequest forUpstream(String resolvedModel, boolean streaming) {
        return toBuilder()
                .model(resolvedModel)
                .stream(streaming ? Boolean.TRUE : null)
                .optimizeFor(null)
                .capability(null)
                .constraints(null)
                .build();
    }
}
