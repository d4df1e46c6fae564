package com.relay.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.config.RelayProperties;
import com.relay.exception.ProviderDispatchException;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.Message;
import com.relay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnthropicProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2024-03-10T12:00:00Z");
    private final List<ClientRequest> sent = new ArrayList<>();

    private RelayProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        RelayProperties.ProviderConfig config = new RelayProperties.ProviderConfig();
        config.setBaseUrl("https://anthropic.test");
        config.setApiKey("provider-key");
        properties.getProviders().put("anthropic", config);
    }

    private AnthropicProvider provider(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    sent.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(body)
                            .build());
                })
                .build();
        return new AnthropicProvider(webClient, properties, objectMapper, clock);
    }

    private static ChatCompletionRequest request(Message... messages) {
        return ChatCompletionRequest.builder()
                .model("claude-3-haiku-20240307")
                .messages(List.of(messages))
                .build();
    }

    @Nested
    @DisplayName("request conversion")
    class RequestConversion {

        @Test
        @DisplayName("should lift system messages into the system field")
        void liftsSystem() {
            JsonNode body = provider(HttpStatus.OK, "{}").toAnthropicFormat(request(
                    Message.of("system", "Be brief."),
                    Message.of("system", "Answer in English."),
                    Message.of("user", "Hi"),
                    Message.of("assistant", "Hello"),
                    Message.of("user", "Bye")), false);

            assertThat(body.get("system").asText()).isEqualTo("Be brief.\n\nAnswer in English.");
            assertThat(body.get("messages")).hasSize(3);
            assertThat(body.get("messages").get(1).get("role").asText()).isEqualTo("assistant");
            assertThat(body.get("messages").get(2).get("content").get(0).get("text").asText()).isEqualTo("Bye");
            assertThat(body.has("stream")).isFalse();
        }

        @Test
        @DisplayName("should default max_tokens and mark streaming requests")
        void defaultsMaxTokens() {
            JsonNode body = provider(HttpStatus.OK, "{}").toAnthropicFormat(request(Message.of("user", "Hi")), true);

            assertThat(body.get("max_tokens").asInt()).isEqualTo(4096);
            assertThat(body.get("stream").asBoolean()).isTrue();
            assertThat(body.has("system")).isFalse();
        }

        @Test
        @DisplayName("should forward sampling parameters")
        void forwardsSampling() {
            ChatCompletionRequest request = request(Message.of("user", "Hi")).toBuilder()
                    .maxTokens(100)
                    .temperature(0.2)
                    .topP(0.9)
                    .build();

            JsonNode body = provider(HttpStatus.OK, "{}").toAnthropicFormat(request, false);

            assertThat(body.get("max_tokens").asInt()).isEqualTo(100);
            assertThat(body.get("temperature").asDouble()).isEqualTo(0.2);
            assertThat(body.get("top_p").asDouble()).isEqualTo(0.9);
        }
    }

    @Nested
    @DisplayName("response conversion")
    class ResponseConversion {

        @Test
        @DisplayName("should join text blocks and map usage")
        void convertsResponse() throws Exception {
            JsonNode response = objectMapper.readTree("""
                    {"id":"msg_1","content":[{"type":"text","text":"Hello"},{"type":"tool_use","id":"t"},
                     {"type":"text","text":" world"}],"stop_reason":"end_turn",
                     "usage":{"input_tokens":10,"output_tokens":5}}
                    """);

            ChatCompletionResponse converted = provider(HttpStatus.OK, "{}").toOpenAIFormat(response, "claude-3-haiku-20240307");

            assertThat(converted.getId()).isEqualTo("chatcmpl-msg_1");
            assertThat(converted.getCreated()).isEqualTo(1710072000L);
            assertThat(converted.getChoices().get(0).getMessage().getContent()).isEqualTo("Hello world");
            assertThat(converted.getChoices().get(0).getFinishReason()).isEqualTo("stop");
            assertThat(converted.getUsage().getPromptTokens()).isEqualTo(10);
            assertThat(converted.getUsage().getCompletionTokens()).isEqualTo(5);
            assertThat(converted.getUsage().getTotalTokens()).isEqualTo(15);
        }

        @Test
        @DisplayName("should map max_tokens to length")
        void mapsLength() throws Exception {
            JsonNode response = objectMapper.readTree("{\"content\":[],\"stop_reason\":\"max_tokens\"}");

            ChatCompletionResponse converted = provider(HttpStatus.OK, "{}").toOpenAIFormat(response, "m");

            assertThat(converted.getChoices().get(0).getFinishReason()).isEqualTo("length");
            assertThat(converted.getId()).startsWith("chatcmpl-");
            assertThat(converted.getUsage()).isNull();
        }
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        @DisplayName("should post to the messages endpoint with the pool key")
        void postsWithPoolKey() {
            AnthropicProvider provider = provider(HttpStatus.OK,
                    "{\"id\":\"msg_2\",\"content\":[{\"type\":\"text\",\"text\":\"ok\"}],\"stop_reason\":\"end_turn\"}");

            StepVerifier.create(provider.complete(request(Message.of("user", "Hi")), "pool-key"))
                    .assertNext(response -> assertThat(response.getChoices().get(0).getMessage().getContent())
                            .isEqualTo("ok"))
                    .verifyComplete();

            ClientRequest request = sent.get(0);
            assertThat(request.url().toString()).isEqualTo("https://anthropic.test/v1/messages");
            assertThat(request.headers().getFirst("x-api-key")).isEqualTo("pool-key");
            assertThat(request.headers().getFirst("anthropic-version")).isEqualTo("2023-06-01");
        }

        @Test
        @DisplayName("should fall back to the provider key without a pool credential")
        void usesProviderKey() {
            AnthropicProvider provider = provider(HttpStatus.OK, "{\"content\":[]}");

            StepVerifier.create(provider.complete(request(Message.of("user", "Hi")), null))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(sent.get(0).headers().getFirst("x-api-key")).isEqualTo("provider-key");
        }

        @Test
        @DisplayName("should wrap upstream HTTP errors and keep the status as cause")
        void wrapsErrors() {
            AnthropicProvider provider = provider(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}");

            StepVerifier.create(provider.complete(request(Message.of("user", "Hi")), "pool-key"))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ProviderDispatchException.class);
                        assertThat(error.getCause()).isInstanceOf(WebClientResponseException.class);
                        assertThat(((WebClientResponseException) error.getCause()).getStatusCode().value())
                                .isEqualTo(429);
                    })
                    .verify();
        }

        @Test
        @DisplayName("should stream raw body bytes")
        void streamsBytes() {
            String sse = "event: message_stop\ndata: {\"type\":\"message_stop\"}\n\n";
            AnthropicProvider provider = provider(HttpStatus.OK, sse);

            StepVerifier.create(provider.stream(request(Message.of("user", "Hi")), "pool-key")
                            .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                            .reduce(String::concat))
                    .expectNext(sse)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to dispatch when not configured")
        void notEnabled() {
            properties.getProviders().get("anthropic").setEnabled(false);
            AnthropicProvider provider = provider(HttpStatus.OK, "{}");

            assertThat(provider.isEnabled()).isFalse();
            StepVerifier.create(provider.complete(request(Message.of("user", "Hi")), "pool-key"))
                    .expectError(ProviderDispatchException.class)
                    .verify();
            assertThat(sent).isEmpty();
        }
    }
}
