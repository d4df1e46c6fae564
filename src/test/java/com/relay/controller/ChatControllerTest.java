package com.relay.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.config.RelayProperties;
import com.relay.exception.GlobalExceptionHandler;
import com.relay.exception.NoEligibleProviderException;
import com.relay.exception.ProviderDispatchException;
import com.relay.exception.QuotaExhaustedException;
import com.relay.model.ChatCompletionChunk;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.Choice;
import com.relay.model.Delta;
import com.relay.model.Message;
import com.relay.model.RelayHeaders;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.model.routing.RoutingState;
import com.relay.service.RoutingHeaderParser;
import com.relay.service.RoutingRequestFactory;
import com.relay.service.RoutingService;
import com.relay.service.StreamingService;
import com.relay.service.quota.UpgradePrompt;
import com.relay.service.routing.RoutedCompletion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private static final String BODY = "{\"model\":\"auto\",\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}";
    private static final String STREAM_BODY =
            "{\"model\":\"auto\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}";

    private RoutingService routingService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        routingService = mock(RoutingService.class);
        ChatController controller = new ChatController(routingService,
                new StreamingService(new ObjectMapper()),
                new RoutingHeaderParser(),
                new RoutingRequestFactory(new RelayProperties()),
                new ObjectMapper());
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static RoutingDecision decision(boolean fallback) {
        return RoutingDecision.builder()
                .requestId("req_1")
                .userId("user-1")
                .provider(ProviderType.ANTHROPIC)
                .model("claude-3-haiku-20240307")
                .strategy(OptimizationStrategy.COST)
                .reasoning("cheapest")
                .alternatives(List.of())
                .fallback(fallback)
                .state(fallback ? RoutingState.FALLBACK_DISPATCHED : RoutingState.DISPATCHED)
                .build();
    }

    @Test
    @DisplayName("should return the completion with provenance headers")
    void completesWithProvenance() {
        ChatCompletionResponse response = ChatCompletionResponse.builder()
                .id("chatcmpl-1")
                .object("chat.completion")
                .created(1L)
                .model("claude-3-haiku-20240307")
                .choices(List.of(Choice.builder().index(0)
                        .message(Message.of(Message.ROLE_ASSISTANT, "Hello")).finishReason("stop").build()))
                .build();
        when(routingService.complete(any())).thenReturn(Mono.just(new RoutedCompletion(response, decision(true), 24L, 120)));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header(RelayHeaders.USER, "user-1")
                .header(RelayHeaders.OPTIMIZE_FOR, "cost")
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(RelayHeaders.PROVIDER, "anthropic")
                .expectHeader().valueEquals(RelayHeaders.MODEL, "claude-3-haiku-20240307")
                .expectHeader().valueEquals(RelayHeaders.FALLBACK, "true")
                .expectHeader().valueEquals(RelayHeaders.REQUEST_ID, "req_1")
                .expectHeader().valueEquals(RelayHeaders.QUOTA_REMAINING, "24")
                .expectBody()
                .jsonPath("$.choices[0].message.content").isEqualTo("Hello");

        ArgumentCaptor<RoutingRequest> captor = ArgumentCaptor.forClass(RoutingRequest.class);
        verify(routingService).complete(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo("user-1");
        assertThat(captor.getValue().getOptimizeFor()).isEqualTo(OptimizationStrategy.COST);
    }

    @Test
    @DisplayName("should stream SSE events terminated by DONE")
    void streamsEvents() {
        when(routingService.stream(any(), any())).thenAnswer(invocation -> {
            Consumer<RoutingDecision> onDispatched = invocation.getArgument(1);
            return Flux.just(
                            ChatCompletionChunk.of("chatcmpl-1", 1L, "gpt-4o", Delta.text("Hi"), null),
                            ChatCompletionChunk.of("chatcmpl-1", 1L, "gpt-4o", Delta.empty(), "stop"))
                    .doOnNext(chunk -> {
                        if (chunk.finishReason() == null) {
                            onDispatched.accept(decision(false));
                        }
                    });
        });

        String body = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(STREAM_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals(RelayHeaders.PROVIDER, "anthropic")
                .expectHeader().exists(RelayHeaders.REQUEST_ID)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertThat(body).startsWith("data: {");
        assertThat(body).doesNotContain("data:data:");
        assertThat(body).contains("\"content\":\"Hi\"");
        assertThat(body).endsWith("data: [DONE]\n\n");
    }

    @Test
    @DisplayName("should refuse a stream with 429 and the upgrade prompt when quota is exhausted")
    void streamRefusedWhenQuotaExhausted() {
        when(routingService.stream(any(), any())).thenReturn(Flux.error(
                new QuotaExhaustedException("Daily limit reached", UpgradePrompt.forRemaining(0))));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(STREAM_BODY)
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectHeader().doesNotExist(RelayHeaders.PROVIDER)
                .expectBody()
                .jsonPath("$.error").isEqualTo("quota_exhausted")
                .jsonPath("$.upgradePrompt.urgency").isEqualTo("CRITICAL");
    }

    @Test
    @DisplayName("should refuse a stream with 422 when no provider satisfies the constraints")
    void streamRefusedWhenNoProviderEligible() {
        when(routingService.stream(any(), any())).thenReturn(Flux.error(
                new NoEligibleProviderException("No candidate satisfies maxCost")));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(STREAM_BODY)
                .exchange()
                .expectStatus().isEqualTo(422);
    }

    @Test
    @DisplayName("should reject malformed routing headers before routing")
    void rejectsBadHeaders() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header(RelayHeaders.MAX_COST, "cheap")
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_request")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains(RelayHeaders.MAX_COST));

        verifyNoInteractions(routingService);
    }

    @Test
    @DisplayName("should reject requests without messages")
    void rejectsEmptyMessages() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"auto\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("should report every provider tried when dispatch fails")
    void reportsDispatchFailure() {
        when(routingService.complete(any())).thenReturn(Mono.error(new ProviderDispatchException("all failed",
                List.of(ProviderType.ANTHROPIC, ProviderType.GOOGLE), null)));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("provider_dispatch_failed")
                .jsonPath("$.attemptedProviders[0]").isEqualTo("anthropic")
                .jsonPath("$.attemptedProviders[1]").isEqualTo("google");
    }
}
