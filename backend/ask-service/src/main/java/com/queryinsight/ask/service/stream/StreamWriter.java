package com.queryinsight.ask.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryinsight.ask.dto.stream.StateType;
import com.queryinsight.ask.dto.stream.StreamEvent;
import com.queryinsight.ask.dto.stream.StreamEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound SSE channel of a single request.
 *
 * Every call becomes one {@code data:} frame holding a JSON {@link StreamEvent}. WebFlux
 * flushes per element, so the client sees each event as soon as it is written.
 * {@code message_start} and {@code message_stop} are emitted at most once; after
 * {@link #stop} every write is ignored.
 */
@Slf4j
public class StreamWriter {

    /**
     * Pipeline callbacks and the stage timeout may write from different threads at once
     */
    private static final Duration CONTENDED_EMIT_RETRY = Duration.ofSeconds(1);

    private final ObjectMapper objectMapper;
    private final Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public StreamWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Outbound event stream. Completes after {@link #stop}.
     */
    public Flux<ServerSentEvent<String>> asFlux() {
        return sink.asFlux();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        write(event(StreamEventType.MESSAGE_START).build());
    }

    public void state(StateType state, Map<String, Object> fields) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("state", state);
        if (fields != null) {
            data.putAll(fields);
        }
        write(event(StreamEventType.STATE).data(data).build());
    }

    public void contentBlockStart(String name) {
        write(event(StreamEventType.CONTENT_BLOCK_START)
                .contentBlock(StreamEvent.ContentBlock.text(name))
                .build());
    }

    public void contentBlockDelta(String text) {
        write(event(StreamEventType.CONTENT_BLOCK_DELTA)
                .delta(StreamEvent.Delta.text(text))
                .build());
    }

    public void contentBlockStop() {
        write(event(StreamEventType.CONTENT_BLOCK_STOP).build());
    }

    public void error(String message, String code, Map<String, Object> additionalData) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", message);
        if (code != null) {
            data.put("code", code);
        }
        if (additionalData != null) {
            data.putAll(additionalData);
        }
        write(event(StreamEventType.ERROR).data(data).build());
    }

    /**
     * Emits {@code message_stop} and closes the channel. Safe to call from any path.
     */
    public void stop(String threadId, long durationMs) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("threadId", threadId);
        data.put("duration", durationMs);
        emit(event(StreamEventType.MESSAGE_STOP).data(data).build());
        sink.emitComplete(Sinks.EmitFailureHandler.busyLooping(CONTENDED_EMIT_RETRY));
    }

    private StreamEvent.StreamEventBuilder event(StreamEventType type) {
        return StreamEvent.builder()
                .type(type)
                .timestamp(System.currentTimeMillis());
    }

    private void write(StreamEvent event) {
        if (stopped.get()) {
            log.debug("Dropping {} event written after message_stop", event.getType());
            return;
        }
        emit(event);
    }

    private void emit(StreamEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream event " + event.getType(), e);
        }
        Sinks.EmitFailureHandler retryContended = Sinks.EmitFailureHandler.busyLooping(CONTENDED_EMIT_RETRY);
        sink.emitNext(ServerSentEvent.<String>builder().data(json).build(), (signal, result) -> {
            if (retryContended.onEmitFailure(signal, result)) {
                return true;
            }
            // FAIL_CANCELLED once the client is gone
            log.debug("Stream event {} not delivered: {}", event.getType(), result);
            return false;
        });
    }
}
