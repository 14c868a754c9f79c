package me.golemcore.agentstream.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.adapter.inbound.web.WireFrameWriter;
import me.golemcore.agentstream.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agentstream.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.agentstream.adapter.inbound.web.filter.RequestIdWebFilter;
import me.golemcore.agentstream.domain.exception.GatewayTimeoutException;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.RunCancellation;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.domain.model.TimeoutHierarchy;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.model.WireEventKind;
import me.golemcore.agentstream.domain.service.RunRequestFactory;
import me.golemcore.agentstream.domain.service.StreamCoordinator;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP transports for agent runs: an SSE stream of wire events and a blocking
 * call returning the aggregated reply. Both are bounded by the connection
 * timeout.
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String TRANSPORT_SSE = "sse";
    static final String TRANSPORT_HTTP = "http";

    private static final String STATUS_COMPLETED = "completed";
    private static final String STATUS_CANCELLED = "cancelled";
    private static final String STATUS_ERROR = "error";

    private final StreamCoordinator streamCoordinator;
    private final RunRequestFactory runRequestFactory;
    private final TimeoutHierarchy timeoutHierarchy;
    private final WireFrameWriter frameWriter;
    private final Scheduler streamScheduler;

    @PostMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@RequestBody ChatRequest body, ServerWebExchange exchange) {
        RunRequest request = createRequest(body, exchange, TRANSPORT_SSE);
        Duration limit = timeoutHierarchy.getConnection().deadline();
        return streamCoordinator.stream(request, new RunCancellation(), limit)
                .map(event -> ServerSentEvent.builder(frameWriter.write(event)).build());
    }

    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest body, ServerWebExchange exchange) {
        RunRequest request = createRequest(body, exchange, TRANSPORT_HTTP);
        Duration limit = timeoutHierarchy.getConnection().deadline();
        return streamCoordinator.stream(request, new RunCancellation())
                .collectList()
                .timeout(limit, streamScheduler)
                .onErrorMap(TimeoutException.class, e -> {
                    log.warn("[API] Chat exceeded connection timeout: threadId={}, runId={}, limit={}",
                            request.getThreadId(), request.getRunId(), limit);
                    return new GatewayTimeoutException(limit);
                })
                .map(events -> ResponseEntity.ok(aggregate(request, events)));
    }

    private RunRequest createRequest(ChatRequest body, ServerWebExchange exchange, String transport) {
        if (body == null) {
            throw new RunValidationException("Invalid request format");
        }
        return runRequestFactory.create(body.getMessage(), body.getThreadId(),
                RequestIdWebFilter.requestIdOf(exchange), body.getAgent(), body.getMetadata(), transport);
    }

    private ChatResponse aggregate(RunRequest request, List<WireEvent> events) {
        StringBuilder content = new StringBuilder();
        String status = STATUS_COMPLETED;
        String error = null;
        for (WireEvent event : events) {
            if (event.kind() == WireEventKind.CHAT_MODEL_STREAM
                    && event.payload().get(RawEngineEvent.DATA_CHUNK) instanceof Map<?, ?> chunk
                    && chunk.get("content") instanceof String text) {
                content.append(text);
            } else if (event.isError()) {
                status = StreamCoordinator.REASON_ENGINE_ERROR.equals(event.reason()) ? STATUS_ERROR : STATUS_CANCELLED;
                Object message = event.payload().get(WireEvent.FIELD_ERROR);
                error = message != null ? message.toString() : null;
            }
        }
        return ChatResponse.builder()
                .threadId(request.getThreadId())
                .runId(request.getRunId())
                .status(status)
                .content(content.toString())
                .error(error)
                .events(events.size())
                .build();
    }
}
