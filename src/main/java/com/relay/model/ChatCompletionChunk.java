package com.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical streaming chunk. Every provider stream is normalized into a sequence of these,
 * sent to clients as SSE events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionChunk {

    public static final String OBJECT = "chat.completion.chunk";

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object;

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<ChunkChoice> choices;

    @JsonProperty("usage")
    private Usage usage;

    /**
     * Choice for streaming chunk with delta instead of message.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class ChunkChoice {

        @JsonProperty("index")
        private Integer index;

        @JsonProperty("delta")
        private Delta delta;

        @JsonProperty("finish_reason")
        private String finishReason;  // null until the terminal chunk
    }

    public static ChatCompletionChunk of(String id, long created, String model, Delta delta, String finishReason) {
        return ChatCompletionChunk.builder()
                .id(id)
                .object(OBJECT)
                .created(created)
                .model(model)
                .choices(List.of(ChunkChoice.builder()
                        .index(0)
                        .delta(delta != null ? delta : Delta.empty())
                        .finishReason(finishReason)
                        .build()))
                .build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return finishReason() != null;
    }

    @JsonIgnore
    public String finishReason() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        return choices.get(0).getFinishReason();
    }

    @JsonIgnore
    public String contentDelta() {
        if (choices == null || choices.isEmpty() || choices.get(0).getDelta() == null) {
            return null;
        }
        return choices.get(0).getDelta().getContent();
    }
}
