package me.golemcore.agentstream.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.RunCancellation;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.domain.model.RunSession;
import me.golemcore.agentstream.domain.model.RunState;
import me.golemcore.agentstream.domain.model.StopReason;
import me.golemcore.agentstream.domain.model.TimeoutHierarchy;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.model.WireEventKind;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one run from the engine's event source to the transport.
 *
 * <p>
 * For every run the coordinator:
 * <ul>
 * <li>moves the run through {@code PENDING -> STREAMING -> COMPLETED |
 * CANCELLED | ERROR}</li>
 * <li>normalizes each allowed raw event into exactly one wire event, in engine
 * order, with per-run sequence numbers</li>
 * <li>enforces the run deadline and per-tool deadlines</li>
 * <li>turns cancellation, timeout and engine failure into exactly one terminal
 * {@code on_error} event and completes normally</li>
 * <li>hands signals that arrive after completion to the
 * {@link CheckpointRaceGuard}</li>
 * </ul>
 *
 * <p>
 * Cancellation is observed through the {@link RunCancellation} token and
 * through downstream cancellation of the returned flux. Nothing is retried
 * here.
 */
@Service
@Slf4j
public class StreamCoordinator {

    public static final String CANCELLED_MESSAGE = "Agent execution was cancelled";
    public static final String FAILED_MESSAGE = "Agent execution failed";
    public static final String REASON_ENGINE_ERROR = "engine_error";

    private static final int MAX_FILTERED_EVENT_LOGS = 50;

    private final EventNormalizer normalizer;
    private final CheckpointRaceGuard raceGuard;
    private final TimeoutHierarchy timeouts;
    private final AgentEngineRegistry engineRegistry;
    private final ErrorSanitizer errorSanitizer;
    private final Scheduler scheduler;
    private final Set<String> allowedEvents;

    public StreamCoordinator(EventNormalizer normalizer, CheckpointRaceGuard raceGuard, TimeoutHierarchy timeouts,
            AgentEngineRegistry engineRegistry, ErrorSanitizer errorSanitizer, Scheduler scheduler,
            AgentStreamProperties properties) {
        this.normalizer = normalizer;
        this.raceGuard = raceGuard;
        this.timeouts = timeouts;
        this.engineRegistry = engineRegistry;
        this.errorSanitizer = errorSanitizer;
        this.scheduler = scheduler;
        this.allowedEvents = new HashSet<>(properties.getStream().getAllowedEvents());
    }

    /**
     * Streams a run bounded by the stream timeout scope.
     */
    public Flux<WireEvent> stream(RunRequest request, RunCancellation cancellation) {
        return stream(request, cancellation, timeouts.getStream().deadline());
    }

    /**
     * Streams a run bounded by {@code deadline}. The returned flux always
     * completes normally; failures arrive as a final {@code on_error} event.
     */
    public Flux<WireEvent> stream(RunRequest request, RunCancellation cancellation, Duration deadline) {
        return Flux.defer(() -> {
            RunSession session = new RunSession(request.getThreadId(), request.getRunId(), Instant.ofEpochMilli(now()));
            log.info("[Stream] Run started: threadId={}, runId={}, transport={}",
                    session.getThreadId(), session.getRunId(), request.getTransport());

            Mono<StopReason> stopSignal = Mono.firstWithValue(
                    cancellation.whenCancelled(),
                    Mono.delay(deadline, scheduler).thenReturn(StopReason.STREAM_TIMEOUT))
                    .doOnNext(session::requestStop);

            return Flux.defer(() -> engineRegistry.resolve(request.getAgentName()).stream(request))
                    .doOnSubscribe(subscription -> session.transition(RunState.STREAMING))
                    .<WireEvent>handle((raw, sink) -> accept(session, raw, sink))
                    .timeout(Mono.<Long>never(), event -> nextDeadline(session))
                    .takeUntilOther(stopSignal)
                    .onErrorResume(error -> absorbError(session, error))
                    .concatWith(Mono.defer(() -> finish(session)))
                    .doOnCancel(() -> onDownstreamCancel(session));
        });
    }

    private void accept(RunSession session, RawEngineEvent raw, SynchronousSink<WireEvent> sink) {
        String kind = raw.getKind();
        if (session.isLogicallyComplete()) {
            log.debug("[Stream] Dropped event after completion: threadId={}, kind={}", session.getThreadId(), kind);
            return;
        }
        session.recordReceived(kind);
        session.captureTraceId(traceIdOf(raw));

        if (kind == null || !allowedEvents.contains(kind) || WireEventKind.fromRawKind(kind).isEmpty()) {
            if (session.recordFiltered() <= MAX_FILTERED_EVENT_LOGS) {
                log.debug("[Stream] Filtered event kind: {}", kind);
            }
            return;
        }

        trackTool(session, raw);
        sink.next(normalizer.normalize(raw, metadataFor(session, raw)));

        if (RawEngineEvent.CHAT_MODEL_END.equals(kind)) {
            session.advanceShard();
        }
        if (RawEngineEvent.CHAIN_END.equals(kind) && raw.isRoot()) {
            raceGuard.markCompleted(session, now());
        }
    }

    private void trackTool(RunSession session, RawEngineEvent raw) {
        String kind = raw.getKind();
        String toolRunId = raw.getRunId() != null ? raw.getRunId() : "tool:" + raw.getName();
        if (RawEngineEvent.TOOL_START.equals(kind)) {
            Duration limit = timeouts.scopeForTool(raw.getName()).deadline();
            session.openTool(toolRunId, raw.getName(), now() + limit.toMillis());
        } else if (RawEngineEvent.TOOL_END.equals(kind) || RawEngineEvent.TOOL_ERROR.equals(kind)) {
            session.closeTool(toolRunId);
        }
    }

    private Map<String, Object> metadataFor(RunSession session, RawEngineEvent raw) {
        Map<String, Object> metadata = baseMetadata(session);
        if (raw.getKind().startsWith("on_chat_model")) {
            metadata.put("shard", session.getShard());
        }
        if (raw.getRunId() != null) {
            metadata.put("source_run_id", raw.getRunId());
        }
        return metadata;
    }

    private Map<String, Object> baseMetadata(RunSession session) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("thread_id", session.getThreadId());
        metadata.put("run_id", session.getRunId());
        metadata.put("seq", session.nextSequence());
        session.getTraceId().ifPresent(traceId -> metadata.put("trace_id", traceId));
        return metadata;
    }

    private String traceIdOf(RawEngineEvent raw) {
        Object traceId = raw.getMetadata() != null ? raw.getMetadata().get(RawEngineEvent.METADATA_TRACE_ID) : null;
        return traceId != null ? traceId.toString() : null;
    }

    private Mono<Long> nextDeadline(RunSession session) {
        if (session.isLogicallyComplete()) {
            // engine still open after completion: give persistence the grace window, then stop waiting
            return Mono.delay(raceGuard.getGraceWindow(), scheduler);
        }
        return session.earliestOpenTool()
                .map(tool -> Mono.delay(Duration.ofMillis(Math.max(0L, tool.deadlineMillis() - now())), scheduler)
                        .doOnNext(tick -> {
                            if (session.requestStop(StopReason.TOOL_TIMEOUT)) {
                                log.warn("[Stream] Tool exceeded its timeout: threadId={}, tool={}",
                                        session.getThreadId(), tool.name());
                            }
                        }))
                .orElseGet(Mono::never);
    }

    private Flux<WireEvent> absorbError(RunSession session, Throwable error) {
        if (session.isLogicallyComplete()) {
            if (error instanceof TimeoutException) {
                log.debug("[Stream] Engine source still open after grace window: threadId={}",
                        session.getThreadId());
            } else {
                raceGuard.absorbPostCompletionSignal(session, errorSanitizer.describe(error), now());
            }
            return Flux.empty();
        }
        if (error instanceof TimeoutException && session.getStopReason().isPresent()) {
            return Flux.empty();
        }
        session.recordFailure(error);
        return Flux.empty();
    }

    /**
     * Runs once the engine source is done, whichever way it ended, and emits
     * the terminal event if one is owed.
     */
    private Mono<WireEvent> finish(RunSession session) {
        long now = now();
        if (session.isLogicallyComplete()) {
            session.getStopReason()
                    .ifPresent(reason -> raceGuard.absorbPostCompletionSignal(session, reason.name(), now));
            logCompleted(session);
            return Mono.empty();
        }

        Optional<StopReason> stopReason = session.getStopReason();
        if (stopReason.isPresent()) {
            if (!session.transition(RunState.CANCELLED)) {
                return Mono.empty();
            }
            StopReason reason = stopReason.get();
            logCancellation(session, reason);
            return Mono.just(WireEvent.error(cancellationMessage(reason), reason.getWireReason(),
                    baseMetadata(session)));
        }

        Optional<Throwable> failure = session.getFailure();
        if (failure.isPresent()) {
            if (!session.transition(RunState.ERROR)) {
                return Mono.empty();
            }
            log.error("[Stream] Agent execution failed: threadId={}, runId={}, eventsReceived={}, error={}",
                    session.getThreadId(), session.getRunId(), session.getEventsReceived(),
                    errorSanitizer.describe(failure.get()));
            return Mono.just(WireEvent.error(FAILED_MESSAGE, REASON_ENGINE_ERROR, baseMetadata(session)));
        }

        // source ended without a root completion event
        raceGuard.markCompleted(session, now);
        logCompleted(session);
        return Mono.empty();
    }

    private void onDownstreamCancel(RunSession session) {
        if (session.isLogicallyComplete()) {
            raceGuard.absorbPostCompletionSignal(session, StopReason.CLIENT_DISCONNECT.name(), now());
            return;
        }
        session.requestStop(StopReason.CLIENT_DISCONNECT);
        if (session.transition(RunState.CANCELLED)) {
            logCancellation(session, session.getStopReason().orElse(StopReason.CLIENT_DISCONNECT));
        }
    }

    private String cancellationMessage(StopReason reason) {
        switch (reason) {
        case STREAM_TIMEOUT:
            return CANCELLED_MESSAGE + ": stream timeout exceeded";
        case TOOL_TIMEOUT:
            return CANCELLED_MESSAGE + ": tool timeout exceeded";
        default:
            return CANCELLED_MESSAGE;
        }
    }

    private void logCancellation(RunSession session, StopReason reason) {
        log.atWarn()
                .addKeyValue("thread_id", session.getThreadId())
                .addKeyValue("trace_id", session.getTraceId().orElse(null))
                .addKeyValue("events_received", session.getEventsReceived())
                .addKeyValue("event_kinds", session.getEventKinds())
                .addKeyValue("reason", reason.getWireReason())
                .log("[Stream] Agent execution cancelled: threadId={}, runId={}, eventsReceived={}, cause={}",
                        session.getThreadId(), session.getRunId(), session.getEventsReceived(), reason);
    }

    private void logCompleted(RunSession session) {
        log.info("[Stream] Run completed: threadId={}, runId={}, eventsReceived={}, durationMs={}",
                session.getThreadId(), session.getRunId(), session.getEventsReceived(),
                now() - session.getStartedAt().toEpochMilli());
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
