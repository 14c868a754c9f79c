package me.golemcore.agentstream.adapter.outbound.engine;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.ChatResponseMetadata;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.CheckpointRecord;
import me.golemcore.agentstream.domain.model.CheckpointWrite;
import me.golemcore.agentstream.domain.model.EngineMessage;
import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.domain.service.ErrorSanitizer;
import me.golemcore.agentstream.port.outbound.AgentEnginePort;
import me.golemcore.agentstream.port.outbound.CheckpointPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-step chat agent backed by a langchain4j {@link StreamingChatModel}.
 *
 * <p>
 * A run emits, in order: the root {@code on_chain_start}, then
 * {@code on_chat_model_start}, one {@code on_chat_model_stream} per token,
 * {@code on_chat_model_end}, and finally the root {@code on_chain_end}.
 * Conversation history is kept in the checkpoint store, one checkpoint per
 * completed turn. A failed turn leaves a write on the
 * {@value CheckpointRecord#ERROR_CHANNEL} channel.
 */
@Slf4j
public class Langchain4jAgentEngine implements AgentEnginePort {

    private static final String ROLE_HUMAN = "human";
    private static final String ROLE_AI = "ai";
    private static final String ROLE_SYSTEM = "system";
    private static final String STATE_MESSAGES = "messages";

    private final String agentName;
    private final String modelName;
    private final StreamingChatModel model;
    private final CheckpointPort checkpointPort;
    private final ErrorSanitizer errorSanitizer;
    private final Clock clock;
    private final int maxHistoryMessages;

    public Langchain4jAgentEngine(String agentName, String modelName, StreamingChatModel model,
            CheckpointPort checkpointPort, ErrorSanitizer errorSanitizer, Clock clock, int maxHistoryMessages) {
        this.agentName = agentName;
        this.modelName = modelName;
        this.model = model;
        this.checkpointPort = checkpointPort;
        this.errorSanitizer = errorSanitizer;
        this.clock = clock;
        this.maxHistoryMessages = maxHistoryMessages;
    }

    @Override
    public String getAgentName() {
        return agentName;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Flux<RawEngineEvent> stream(RunRequest request) {
        return Mono.fromFuture(() -> checkpointPort.findLatest(request.getThreadId()))
                .flatMapMany(latest -> Flux.<RawEngineEvent>create(sink -> run(request, latest, sink)));
    }

    private void run(RunRequest request, Optional<CheckpointRecord> latest, FluxSink<RawEngineEvent> sink) {
        String rootRunId = UUID.randomUUID().toString();
        String modelRunId = UUID.randomUUID().toString();
        AtomicBoolean cancelled = new AtomicBoolean();
        sink.onCancel(() -> cancelled.set(true));

        List<Map<String, Object>> history = latest.map(this::historyOf).orElseGet(ArrayList::new);
        List<Map<String, Object>> turn = new ArrayList<>(history);
        turn.add(messageEntry(ROLE_HUMAN, request.getMessage()));
        List<Map<String, Object>> window = turn.size() > maxHistoryMessages
                ? turn.subList(turn.size() - maxHistoryMessages, turn.size())
                : turn;

        EngineMessage human = EngineMessage.builder().role(ROLE_HUMAN).content(request.getMessage()).build();
        Map<String, Object> trace = Map.of(RawEngineEvent.METADATA_TRACE_ID, rootRunId);

        sink.next(event(RawEngineEvent.CHAIN_START, agentName, rootRunId, List.of(), trace,
                RawEngineEvent.DATA_INPUT, Map.of(STATE_MESSAGES, List.of(human))));
        sink.next(event(RawEngineEvent.CHAT_MODEL_START, modelName, modelRunId, List.of(rootRunId), trace,
                RawEngineEvent.DATA_INPUT, Map.of(STATE_MESSAGES, List.of(human))));

        model.chat(toChatMessages(window), new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String token) {
                if (cancelled.get()) {
                    return;
                }
                EngineMessage chunk = EngineMessage.builder().role(ROLE_AI).content(token).id(modelRunId).build();
                sink.next(event(RawEngineEvent.CHAT_MODEL_STREAM, modelName, modelRunId, List.of(rootRunId), trace,
                        RawEngineEvent.DATA_CHUNK, chunk));
            }

            @Override
            public void onCompleteResponse(ChatResponse response) {
                String text = response.aiMessage() != null ? response.aiMessage().text() : "";
                turn.add(messageEntry(ROLE_AI, text));
                // the root chain_end marks the run completed in the store, so the turn must be there first
                saveTurn(request, turn, List.of()).whenComplete((ignored, error) -> {
                    if (cancelled.get()) {
                        return;
                    }
                    EngineMessage reply = EngineMessage.builder()
                            .role(ROLE_AI)
                            .content(text != null ? text : "")
                            .id(modelRunId)
                            .responseMetadata(responseMetadataOf(response.metadata()))
                            .build();
                    sink.next(event(RawEngineEvent.CHAT_MODEL_END, modelName, modelRunId, List.of(rootRunId),
                            trace, RawEngineEvent.DATA_OUTPUT, reply));
                    sink.next(event(RawEngineEvent.CHAIN_END, agentName, rootRunId, List.of(), trace,
                            RawEngineEvent.DATA_OUTPUT, Map.of(STATE_MESSAGES, List.of(reply))));
                    sink.complete();
                });
            }

            @Override
            public void onError(Throwable error) {
                log.warn("[Engine] Model call failed: threadId={}, error={}", request.getThreadId(),
                        errorSanitizer.describe(error));
                CheckpointWrite failure = CheckpointWrite.builder()
                        .taskId(modelRunId)
                        .channel(CheckpointRecord.ERROR_CHANNEL)
                        .value(errorSanitizer.describe(error))
                        .build();
                saveTurn(request, turn, List.of(failure)).whenComplete((ignored, saveError) -> sink.error(error));
            }
        });
    }

    /**
     * Persists the turn. Storage failures are logged and the returned future
     * still completes normally.
     */
    private CompletableFuture<Void> saveTurn(RunRequest request, List<Map<String, Object>> messages,
            List<CheckpointWrite> writes) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CheckpointRecord.METADATA_RUN_ID, request.getRunId());
        metadata.put("source", "loop");
        metadata.put("agent", agentName);

        Map<String, Object> state = new LinkedHashMap<>();
        state.put(STATE_MESSAGES, new ArrayList<>(messages));

        CheckpointRecord checkpoint = CheckpointRecord.builder()
                .threadId(request.getThreadId())
                .checkpointId(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .metadata(metadata)
                .state(state)
                .writes(new ArrayList<>(writes))
                .build();
        return checkpointPort.save(checkpoint).handle((ignored, error) -> {
            if (error != null) {
                log.warn("[Engine] Failed to save checkpoint: threadId={}, error={}", request.getThreadId(),
                        errorSanitizer.describe(error));
            }
            return null;
        });
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> historyOf(CheckpointRecord checkpoint) {
        Object messages = checkpoint.getState() != null ? checkpoint.getState().get(STATE_MESSAGES) : null;
        List<Map<String, Object>> history = new ArrayList<>();
        if (messages instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> map) {
                    history.add((Map<String, Object>) map);
                }
            }
        }
        return history;
    }

    private List<ChatMessage> toChatMessages(List<Map<String, Object>> entries) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            String role = String.valueOf(entry.get("role"));
            String content = String.valueOf(entry.get("content"));
            if (ROLE_AI.equals(role)) {
                messages.add(AiMessage.from(content));
            } else if (ROLE_SYSTEM.equals(role)) {
                messages.add(SystemMessage.from(content));
            } else {
                messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }

    private Map<String, Object> messageEntry(String role, String content) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("role", role);
        entry.put("content", content != null ? content : "");
        return entry;
    }

    private Map<String, Object> responseMetadataOf(ChatResponseMetadata metadata) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (metadata == null) {
            return result;
        }
        if (metadata.modelName() != null) {
            result.put("model_name", metadata.modelName());
        }
        if (metadata.finishReason() != null) {
            result.put("finish_reason", metadata.finishReason().name().toLowerCase(Locale.ROOT));
        }
        TokenUsage usage = metadata.tokenUsage();
        if (usage != null) {
            Map<String, Object> tokens = new LinkedHashMap<>();
            tokens.put("input_tokens", usage.inputTokenCount());
            tokens.put("output_tokens", usage.outputTokenCount());
            tokens.put("total_tokens", usage.totalTokenCount());
            result.put("usage", tokens);
        }
        return result;
    }

    private RawEngineEvent event(String kind, String name, String runId, List<String> parentIds,
            Map<String, Object> metadata, String dataKey, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(dataKey, value);
        return RawEngineEvent.builder()
                .kind(kind)
                .name(name)
                .runId(runId)
                .parentIds(new ArrayList<>(parentIds))
                .data(data)
                .metadata(new LinkedHashMap<>(metadata))
                .build();
    }
}
