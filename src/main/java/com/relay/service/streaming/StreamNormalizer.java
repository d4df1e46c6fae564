package com.relay.service.streaming;

import com.relay.exception.MalformedStreamFrameException;
import com.relay.model.ChatCompletionChunk;
import com.relay.model.Delta;
import com.relay.model.Message;
import com.relay.model.routing.ProviderType;
import com.relay.service.monitoring.RelayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Converts a provider's raw streaming bytes into canonical {@code chat.completion.chunk}s.
 *
 * The result is demand-driven: bytes are only read as the consumer requests chunks. Exactly one
 * chunk carries a finish reason; once it is emitted the transport is cancelled, and a transport
 * that closes without a terminal signal gets a synthetic {@code stop}. Cancelling the result
 * cancels the transport.
 */
@Slf4j
@Service
public class StreamNormalizer {

    private final Map<ProviderType, StreamFrameTranslator> translators = new EnumMap<>(ProviderType.class);
    private final RelayMetrics metrics;
    private final Clock clock;

    public StreamNormalizer(List<StreamFrameTranslator> translators, RelayMetrics metrics, Clock clock) {
        for (StreamFrameTranslator translator : translators) {
            this.translators.put(translator.provider(), translator);
        }
        this.metrics = metrics;
        this.clock = clock;
    }

    public Flux<ChatCompletionChunk> normalize(ProviderType provider, Flux<byte[]> transport, String id, String model) {
        StreamFrameTranslator translator = translators.get(provider);
        if (translator == null) {
            return Flux.error(new IllegalStateException("No stream translator for " + provider));
        }

        return Flux.defer(() -> {
            FrameAssembler assembler = new FrameAssembler(provider.framing());
            AtomicBoolean first = new AtomicBoolean(true);
            long created = clock.instant().getEpochSecond();

            Flux<String> units = transport
                    .concatMapIterable(assembler::feed)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(assembler.flush())));

            return units
                    .concatMap(unit -> translate(translator, unit))
                    .concatWith(Mono.fromSupplier(() -> {
                        log.debug("{} stream {} closed without a terminal signal", provider, id);
                        return TranslatedFrame.terminal(FinishReasons.STOP);
                    }))
                    .takeUntil(TranslatedFrame::isTerminal)
                    .map(frame -> toChunk(frame, id, created, model, first.getAndSet(false)))
                    .doOnCancel(() -> log.debug("{} stream {} cancelled by consumer", provider, id));
        });
    }

    private Mono<TranslatedFrame> translate(StreamFrameTranslator translator, String unit) {
        try {
            return Mono.justOrEmpty(translator.translateFrame(unit));
        } catch (MalformedStreamFrameException e) {
            metrics.recordMalformedFrame(translator.provider());
            log.warn("Skipping malformed {} frame: {}", translator.provider(), e.getMessage());
            return Mono.empty();
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
    }

    private static ChatCompletionChunk toChunk(TranslatedFrame frame, String id, long created, String model,
                                               boolean first) {
        Delta delta = frame.getContent() != null ? Delta.text(frame.getContent()) : Delta.empty();
        if (first) {
            delta.setRole(Message.ROLE_ASSISTANT);
        }
        return ChatCompletionChunk.of(id, created, model, delta, frame.getFinishReason());
    }
}
