package com.relay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.ChatCompletionChunk;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.Choice;
import com.relay.model.Delta;
import com.relay.model.Message;
import com.relay.service.streaming.FinishReasons;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * SSE formatting of canonical chunks, and chunked replay of a buffered completion for providers that
 * cannot stream.
 */
@Slf4j
@Service
public class StreamingService {

    static final String DONE_EVENT = "data: [DONE]\n\n";

    // Characters per replayed chunk
    private static final int REPLAY_CHUNK_SIZE = 8;

    private final ObjectMapper objectMapper;

    public StreamingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Format canonical chunks as SSE events, terminated by {@code data: [DONE]}.
     */
    public Flux<String> toServerSentEvents(Flux<ChatCompletionChunk> chunks) {
        return chunks
                .map(this::formatAsSSE)
                .concatWith(Flux.just(DONE_EVENT));
    }

    /**
     * Replay a buffered completion as canonical chunks. Deterministic: the same response always
     * produces the same chunks.
     */
    public Flux<ChatCompletionChunk> replay(ChatCompletionResponse response) {
        return Flux.fromIterable(chunkResponse(response))
                .doOnComplete(() -> log.debug("Replayed buffered response {} as stream", response.getId()));
    }

    List<ChatCompletionChunk> chunkResponse(ChatCompletionResponse response) {
        List<ChatCompletionChunk> chunks = new ArrayList<>();
        long created = response.getCreated() != null ? response.getCreated() : 0L;
        String finishReason = FinishReasons.STOP;
        String content = "";

        if (response.getChoices() != null && !response.getChoices().isEmpty()) {
            Choice choice = response.getChoices().get(0);
            if (choice.getMessage() != null && choice.getMessage().getContent() != null) {
                content = choice.getMessage().getContent();
            }
            if (choice.getFinishReason() != null) {
                finishReason = choice.getFinishReason();
            }
        }

        chunks.add(ChatCompletionChunk.of(response.getId(), created, response.getModel(),
                Delta.builder().role(Message.ROLE_ASSISTANT).build(), null));
        for (String piece : splitContent(content)) {
            chunks.add(ChatCompletionChunk.of(response.getId(), created, response.getModel(), Delta.text(piece), null));
        }
        ChatCompletionChunk last = ChatCompletionChunk.of(response.getId(), created, response.getModel(),
                Delta.empty(), finishReason);
        last.setUsage(response.getUsage());
        chunks.add(last);
        return chunks;
    }

    /**
     * Split content into small pieces, preferring word boundaries.
     */
    static List<String> splitContent(String content) {
        List<String> pieces = new ArrayList<>();
        int pos = 0;
        while (pos < content.length()) {
            int end = Math.min(pos + REPLAY_CHUNK_SIZE, content.length());
            if (end < content.length()) {
                // Look for a space within the next 3 characters
                for (int i = end; i < Math.min(end + 3, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        end = i + 1;
                        break;
                    }
                }
            }
            pieces.add(content.substring(pos, end));
            pos = end;
        }
        return pieces;
    }

    private String formatAsSSE(ChatCompletionChunk chunk) {
        try {
            return "data: " + objectMapper.writeValueAsString(chunk) + "\n\n";
        } catch (JsonProcessingException e) {
            log.error("Error formatting chunk as SSE", e);
            return "data: {\"error\":\"serialization_error\"}\n\n";
        }
    }
}
