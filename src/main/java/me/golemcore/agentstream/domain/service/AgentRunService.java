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
import me.golemcore.agentstream.domain.exception.AgentRunNotFoundException;
import me.golemcore.agentstream.domain.exception.NoPendingApprovalException;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.model.AgentRunInfo;
import me.golemcore.agentstream.domain.model.AgentRunStatus;
import me.golemcore.agentstream.domain.model.CheckpointRecord;
import me.golemcore.agentstream.domain.model.CheckpointWrite;
import me.golemcore.agentstream.domain.model.HitlAction;
import me.golemcore.agentstream.domain.model.HitlDecision;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.CheckpointPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Run status and human-in-the-loop decisions, both read from and recorded in
 * the checkpoint store.
 *
 * <p>
 * An engine that pauses for approval leaves a write on the
 * {@value CheckpointRecord#INTERRUPT_CHANNEL} channel. A decision is recorded
 * as a new checkpoint attributed to the {@value CheckpointRecord#HUMAN_CHANNEL}
 * node, with the decision merged into the thread state. The next run of the
 * thread starts from that checkpoint.
 */
@Service
@Slf4j
public class AgentRunService {

    static final String SOURCE_UPDATE = "update";

    private final CheckpointPort checkpointPort;
    private final RunRequestFactory runRequestFactory;
    private final ErrorSanitizer errorSanitizer;
    private final Clock clock;
    private final boolean hitlEnabled;

    public AgentRunService(CheckpointPort checkpointPort, RunRequestFactory runRequestFactory,
            ErrorSanitizer errorSanitizer, Clock clock, AgentStreamProperties properties) {
        this.checkpointPort = checkpointPort;
        this.runRequestFactory = runRequestFactory;
        this.errorSanitizer = errorSanitizer;
        this.clock = clock;
        this.hitlEnabled = properties.getFeatures().isHitlEnabled();
    }

    public CompletableFuture<AgentRunInfo> getStatus(String threadId) {
        String thread = runRequestFactory.requireThreadId(threadId);
        return checkpointPort.findLatest(thread).thenApply(latest -> {
            CheckpointRecord checkpoint = latest.orElseThrow(() -> new AgentRunNotFoundException(thread));
            AgentRunInfo info = toRunInfo(checkpoint);
            log.debug("[Runs] Status resolved: threadId={}, status={}", thread, info.getStatus().getValue());
            return info;
        });
    }

    /**
     * Records a human decision for the thread's pending HITL request.
     *
     * @return the checkpoint that carries the decision
     */
    public CompletableFuture<CheckpointRecord> applyDecision(String threadId, HitlDecision decision) {
        if (!hitlEnabled) {
            throw new RunValidationException("HITL is disabled");
        }
        String thread = runRequestFactory.requireThreadId(threadId);
        validate(thread, decision);

        return checkpointPort.findLatest(thread).thenCompose(latest -> {
            CheckpointRecord checkpoint = latest.orElseThrow(() -> new AgentRunNotFoundException(thread));
            if (!checkpoint.hasWritesOn(CheckpointRecord.INTERRUPT_CHANNEL)) {
                throw new NoPendingApprovalException(thread);
            }
            CheckpointRecord update = decisionCheckpoint(checkpoint, decision);
            return checkpointPort.save(update).thenApply(ignored -> {
                log.info("[Runs] HITL decision recorded: threadId={}, runId={}, action={}", thread,
                        decision.getRunId(), decision.getAction().getValue());
                return update;
            });
        });
    }

    private void validate(String threadId, HitlDecision decision) {
        if (decision == null || decision.getAction() == null || isBlank(decision.getRunId())) {
            throw new RunValidationException("Required field missing");
        }
        if (decision.getThreadId() != null && !threadId.equals(decision.getThreadId().strip())) {
            throw new RunValidationException("Thread ID mismatch");
        }
        if (decision.getAction() == HitlAction.RESPOND && isBlank(decision.getResponseText())) {
            throw new RunValidationException("response_text is required for respond action");
        }
        if (decision.getAction() == HitlAction.EDIT
                && (decision.getToolEdits() == null || decision.getToolEdits().isEmpty())) {
            throw new RunValidationException("tool_edits is required for edit action");
        }
    }

    private CheckpointRecord decisionCheckpoint(CheckpointRecord latest, HitlDecision decision) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("approved", true);
        if (decision.getAction() == HitlAction.RESPOND) {
            values.put("custom_response", decision.getResponseText().strip());
        } else if (decision.getAction() == HitlAction.EDIT) {
            values.put("tool_edits", new LinkedHashMap<>(decision.getToolEdits()));
        }

        Map<String, Object> state = new LinkedHashMap<>();
        if (latest.getState() != null) {
            state.putAll(latest.getState());
        }
        state.putAll(values);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CheckpointRecord.METADATA_RUN_ID, decision.getRunId());
        metadata.put("source", SOURCE_UPDATE);
        metadata.put("writes", Map.of(CheckpointRecord.HUMAN_CHANNEL, values));
        metadata.put("parent_checkpoint_id", latest.getCheckpointId());

        List<CheckpointWrite> writes = new ArrayList<>();
        writes.add(CheckpointWrite.builder()
                .taskId(decision.getRunId())
                .channel(CheckpointRecord.HUMAN_CHANNEL)
                .value(values)
                .build());

        return CheckpointRecord.builder()
                .threadId(latest.getThreadId())
                .checkpointId(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .metadata(metadata)
                .state(state)
                .writes(writes)
                .build();
    }

    private AgentRunInfo toRunInfo(CheckpointRecord checkpoint) {
        AgentRunStatus status;
        String error = null;
        if (checkpoint.hasWritesOn(CheckpointRecord.INTERRUPT_CHANNEL)) {
            status = AgentRunStatus.INTERRUPTED;
        } else if (checkpoint.isCompletedNaturally()) {
            status = AgentRunStatus.COMPLETED;
        } else if (checkpoint.hasWritesOn(CheckpointRecord.ERROR_CHANNEL)) {
            status = AgentRunStatus.ERROR;
            error = errorSanitizer.sanitize(errorValueOf(checkpoint));
        } else {
            status = AgentRunStatus.RUNNING;
        }
        boolean finished = status == AgentRunStatus.COMPLETED || status == AgentRunStatus.ERROR;
        String runId = checkpoint.getRunId() != null ? checkpoint.getRunId() : checkpoint.getCheckpointId();
        return AgentRunInfo.builder()
                .runId(runId)
                .threadId(checkpoint.getThreadId())
                .status(status)
                .startedAt(checkpoint.getCreatedAt())
                .completedAt(finished ? checkpoint.getCreatedAt() : null)
                .error(error)
                .metadata(checkpoint.getMetadata() != null ? new LinkedHashMap<>(checkpoint.getMetadata())
                        : Map.of())
                .build();
    }

    private String errorValueOf(CheckpointRecord checkpoint) {
        return checkpoint.getWrites().stream()
                .filter(write -> CheckpointRecord.ERROR_CHANNEL.equals(write.getChannel()))
                .map(write -> String.valueOf(write.getValue()))
                .findFirst()
                .orElse(null);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
