package com.relay.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.RelayHeaders;
import com.relay.model.RoutingHints;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.service.RoutingHeaderParser;
import com.relay.service.RoutingRequestFactory;
import com.relay.service.RoutingService;
import com.relay.service.StreamingService;
import com.relay.service.routing.RoutedCompletion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * OpenAI-compatible chat completions controller with routing provenance headers.
 * Supports both regular and SSE streaming responses.
 *
 * Whether a request streams is only known from its body, so both shapes share one mapping and go out as
 * raw buffers. A stream that fails before its first chunk fails the exchange before the response commits,
 * which lets quota and constraint errors keep their status.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ChatController {

    private final RoutingService routingService;
    private final StreamingService streamingService;
    private final RoutingHeaderParser headerParser;
    private final RoutingRequestFactory requestFactory;
    private final ObjectMapper objectMapper;

    public ChatController(RoutingService routingService,
                          StreamingService streamingService,
                          RoutingHeaderParser headerParser,
                          RoutingRequestFactory requestFactory,
                          ObjectMapper objectMapper) {
        this.routingService = routingService;
        this.streamingService = streamingService;
        this.headerParser = headerParser;
        this.requestFactory = requestFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * Chat completions endpoint - OpenAI compatible, routed across providers.
     * Supports both regular JSON responses and SSE streaming.
     */
    @PostMapping(value = "/chat/completions",
                 consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Flux<DataBuffer>>> createChatCompletion(
            @RequestBody ChatCompletionRequest request,
            @RequestHeader HttpHeaders headers,
            ServerHttpResponse httpResponse) {

        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.getStream());

        RoutingHints hints = headerParser.parse(headers);
        RoutingRequest routingRequest = requestFactory.create(request, hints);

        if (routingRequest.isStream()) {
            return handleStreamingRequest(routingRequest, httpResponse);
        }
        return handleRegularRequest(routingRequest, httpResponse.bufferFactory());
    }

    private Mono<ResponseEntity<Flux<DataBuffer>>> handleRegularRequest(RoutingRequest request,
                                                                       DataBufferFactory bufferFactory) {
        return routingService.complete(request)
                .map(completion -> ResponseEntity.ok()
                        .headers(provenance(completion.getDecision(), completion))
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(Flux.just(bufferFactory.wrap(toJson(completion)))));
    }

    private byte[] toJson(RoutedCompletion completion) {
        try {
            return objectMapper.writeValueAsBytes(completion.getResponse());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion " + completion.getDecision().getRequestId(), e);
        }
    }

    /**
     * Provenance headers are only known once the first chunk arrives, possibly from the fallback, so they
     * are written onto the response just before it commits. Events are already SSE-framed.
     */
    private Mono<ResponseEntity<Flux<DataBuffer>>> handleStreamingRequest(RoutingRequest request,
                                                                         ServerHttpResponse httpResponse) {
        Flux<DataBuffer> events = streamingService.toServerSentEvents(
                routingService.stream(request, decision -> {
                    if (!httpResponse.isCommitted()) {
                        httpResponse.getHeaders().addAll(provenance(decision, null));
                    }
                }))
                .map(event -> httpResponse.bufferFactory().wrap(event.getBytes(StandardCharsets.UTF_8)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_EVENT_STREAM);
        headers.setCacheControl("no-cache");
        headers.add(RelayHeaders.REQUEST_ID, request.getRequestId());

        return Mono.just(ResponseEntity.ok()
                .headers(headers)
                .body(events));
    }

    private static HttpHeaders provenance(RoutingDecision decision, RoutedCompletion completion) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(RelayHeaders.PROVIDER, decision.getProvider().id());
        headers.add(RelayHeaders.MODEL, decision.getModel());
        headers.add(RelayHeaders.FALLBACK, String.valueOf(decision.isFallback()));
        if (completion != null) {
            headers.add(RelayHeaders.REQUEST_ID, decision.getRequestId());
            if (completion.getQuotaRemaining() != null) {
                headers.add(RelayHeaders.QUOTA_REMAINING, String.valueOf(completion.getQuotaRemaining()));
            }
        }
        return headers;
    }
}
