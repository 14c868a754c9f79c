package me.golemcore.agentstream.adapter.inbound.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.model.RunCancellation;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.domain.model.StopReason;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.service.ActiveRunRegistry;
import me.golemcore.agentstream.domain.service.ErrorSanitizer;
import me.golemcore.agentstream.domain.service.RunRequestFactory;
import me.golemcore.agentstream.domain.service.StreamCoordinator;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.concurrent.Queues;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reactive WebSocket handler for agent runs. Handles JSON envelopes:
 * {@code {"type": "chat", "message": "...", "thread_id": "...",
 * "request_id": "..."}} and {@code {"type": "cancel"}}. Each wire event of a
 * run goes out as one text frame, in order.
 *
 * <p>
 * The connection timeout does not apply here; a run is bounded by the stream
 * timeout only. Closing the socket cancels the connection's active run.
 *
 * <p>
 * Run events are pulled by the socket's outbound demand, at most one event
 * ahead of the transport. A client that stops reading suspends its run at the
 * next event instead of letting frames pile up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketChatHandler implements WebSocketHandler {

    static final String TRANSPORT = "websocket";
    static final String REASON_INVALID_REQUEST = "invalid_request";

    private static final String TYPE_CHAT = "chat";
    private static final String TYPE_CANCEL = "cancel";
    private static final TypeReference<Map<String, Object>> ENVELOPE_TYPE = new TypeReference<>() {
    };

    private final StreamCoordinator streamCoordinator;
    private final ActiveRunRegistry activeRunRegistry;
    private final RunRequestFactory runRequestFactory;
    private final ErrorSanitizer errorSanitizer;
    private final WireFrameWriter frameWriter;
    private final ObjectMapper objectMapper;
    private final AgentStreamProperties properties;
    private final Scheduler streamScheduler;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: connectionId={}", connectionId);

        Outbox outbox = new Outbox(connectionId);
        Sinks.Empty<Void> closed = Sinks.empty();

        Duration interval = properties.getStream().getHeartbeatInterval();
        Flux<WebSocketMessage> heartbeat = Flux.interval(interval, interval, streamScheduler)
                .map(tick -> session.pingMessage(factory -> factory.wrap(new byte[0])))
                .takeUntilOther(closed.asMono());

        Flux<WebSocketMessage> outbound = Flux.merge(outbox.frames().map(session::textMessage), heartbeat);

        Mono<Void> inbound = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(message -> handleIncoming(message.getPayloadAsText(), connectionId, outbox))
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    activeRunRegistry.cancel(connectionId, StopReason.CLIENT_DISCONNECT);
                    closed.tryEmitEmpty();
                    outbox.close();
                })
                .then();

        return session.send(outbound).and(inbound);
    }

    void handleIncoming(String payload, String connectionId, Outbox outbox) {
        Map<String, Object> envelope;
        try {
            envelope = objectMapper.readValue(payload, ENVELOPE_TYPE);
        } catch (IOException e) {
            log.debug("[WebSocket] Malformed envelope: connectionId={}, error={}", connectionId,
                    e.getClass().getSimpleName());
            outbox.send(frameWriter.write(rejection("Invalid request format", null)));
            return;
        }
        if (envelope == null) {
            outbox.send(frameWriter.write(rejection("Invalid request format", null)));
            return;
        }

        Object type = envelope.get("type");
        if (TYPE_CANCEL.equals(type)) {
            boolean cancelled = activeRunRegistry.cancel(connectionId, StopReason.ABORTED);
            log.debug("[WebSocket] Cancel requested: connectionId={}, cancelled={}", connectionId, cancelled);
            return;
        }
        if (!TYPE_CHAT.equals(type)) {
            outbox.send(frameWriter.write(rejection("Unknown message type", null)));
            return;
        }
        startRun(envelope, connectionId, outbox);
    }

    private void startRun(Map<String, Object> envelope, String connectionId, Outbox outbox) {
        RunRequest request;
        try {
            request = runRequestFactory.create(
                    asString(envelope.get("message")),
                    asString(envelope.get("thread_id")),
                    asString(envelope.get("request_id")),
                    asString(envelope.get("agent")),
                    asMap(envelope.get("metadata")),
                    TRANSPORT);
        } catch (RunValidationException e) {
            log.debug("[WebSocket] Rejected chat envelope: connectionId={}, reason={}", connectionId,
                    e.getMessage());
            outbox.send(frameWriter.write(rejection(e.getMessage(), null)));
            return;
        }

        Optional<RunCancellation> cancellation = activeRunRegistry.register(connectionId, request.getRunId(),
                request.getThreadId());
        if (cancellation.isEmpty()) {
            outbox.send(frameWriter.write(rejection("A run is already active on this connection", request)));
            return;
        }

        Flux<String> run = streamCoordinator.stream(request, cancellation.get())
                .map(frameWriter::write)
                .onErrorResume(error -> {
                    log.error("[WebSocket] Run delivery failed: connectionId={}, runId={}, error={}",
                            connectionId, request.getRunId(), errorSanitizer.describe(error));
                    return Flux.empty();
                })
                .doFinally(signal -> activeRunRegistry.release(connectionId, request.getRunId()));
        if (!outbox.enqueueRun(run)) {
            activeRunRegistry.release(connectionId, request.getRunId());
        }
    }

    private WireEvent rejection(String message, RunRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request != null) {
            metadata.put("thread_id", request.getThreadId());
            metadata.put("run_id", request.getRunId());
        }
        return WireEvent.error(errorSanitizer.safeValidationMessage(message), REASON_INVALID_REQUEST, metadata);
    }

    private String asString(Object value) {
        if (value instanceof String stringValue) {
            return stringValue;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    /**
     * Outbound text frames of one connection. Replies are pushed from the receive
     * loop; runs are queued as cold publishers and drained one after another, so
     * each run is only pulled as fast as the socket accepts frames.
     */
    static final class Outbox {

        private static final int REPLY_BUFFER_SIZE = 64;

        private final String connectionId;
        private final Sinks.Many<String> replies = Sinks.many().unicast()
                .onBackpressureBuffer(Queues.<String>get(REPLY_BUFFER_SIZE).get());
        private final Sinks.Many<Flux<String>> runs = Sinks.many().unicast().onBackpressureBuffer();

        Outbox(String connectionId) {
            this.connectionId = connectionId;
        }

        Flux<String> frames() {
            return Flux.merge(1, replies.asFlux(), runs.asFlux().concatMap(run -> run, 1));
        }

        synchronized void send(String frame) {
            Sinks.EmitResult result = replies.tryEmitNext(frame);
            if (result.isFailure()) {
                log.debug("[WebSocket] Reply dropped: connectionId={}, result={}", connectionId, result);
            }
        }

        /**
         * Queues a run for delivery.
         *
         * @return false if the connection is already closed
         */
        synchronized boolean enqueueRun(Flux<String> run) {
            Sinks.EmitResult result = runs.tryEmitNext(run);
            if (result.isFailure()) {
                log.debug("[WebSocket] Run not queued: connectionId={}, result={}", connectionId, result);
                return false;
            }
            return true;
        }

        synchronized void close() {
            replies.tryEmitComplete();
            runs.tryEmitComplete();
        }
    }
}
