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
import me.golemcore.agentstream.domain.model.CheckpointRecord;
import me.golemcore.agentstream.domain.model.RunSession;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.CheckpointPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Absorbs races between a run's logical completion and the checkpoint store's
 * own finalization.
 *
 * <p>
 * Once the engine reports completion, a run is logically complete. A
 * cancellation or error observed after that point never reaches the client:
 * inside the grace window it is logged at debug as a post-completion race,
 * after the window at warn, since a late error may be genuine.
 *
 * <p>
 * Error entries that the store wrote during such races stay behind on the
 * {@value CheckpointRecord#ERROR_CHANNEL} channel of checkpoints whose run
 * completed. {@link #cleanupFalseErrors()} removes them; it runs from the
 * maintenance scheduler and the admin endpoint, never per run.
 */
@Service
@Slf4j
public class CheckpointRaceGuard {

    private final CheckpointPort checkpointPort;
    private final Clock clock;
    private final Duration graceWindow;

    public CheckpointRaceGuard(CheckpointPort checkpointPort, Clock clock, AgentStreamProperties properties) {
        this.checkpointPort = checkpointPort;
        this.clock = clock;
        this.graceWindow = properties.getCheckpoint().getGraceWindow();
    }

    public Duration getGraceWindow() {
        return graceWindow;
    }

    /**
     * Flags the run as logically complete and records the completion on its
     * checkpoints. The store update is best effort and does not block the
     * stream.
     */
    public void markCompleted(RunSession session, long nowMillis) {
        if (!session.markLogicallyComplete(nowMillis)) {
            return;
        }
        log.debug("[Checkpoint] Run logically complete: threadId={}, runId={}",
                session.getThreadId(), session.getRunId());
        try {
            checkpointPort.markRunCompleted(session.getThreadId(), session.getRunId())
                    .whenComplete((updated, error) -> {
                        if (error != null) {
                            log.warn("[Checkpoint] Failed to mark run completed: threadId={}, runId={}, error={}",
                                    session.getThreadId(), session.getRunId(), error.getMessage());
                        }
                    });
        } catch (RuntimeException e) { // NOSONAR - completion marking is best effort
            log.warn("[Checkpoint] Failed to mark run completed: threadId={}, error={}",
                    session.getThreadId(), e.getMessage());
        }
    }

    /**
     * Handles a cancellation or error signal that arrived after the run
     * completed.
     *
     * @return true if the signal fell inside the grace window
     */
    public boolean absorbPostCompletionSignal(RunSession session, String signal, long observedAtMillis) {
        long sinceCompletion = observedAtMillis - session.getCompletedAtMillis();
        if (sinceCompletion <= graceWindow.toMillis()) {
            log.debug("[Checkpoint] Suppressed post-completion race: threadId={}, signal={}, afterMs={}",
                    session.getThreadId(), signal, sinceCompletion);
            return true;
        }
        log.warn("[Checkpoint] Late error after completion ignored: threadId={}, signal={}, afterMs={}, "
                + "graceWindowMs={}", session.getThreadId(), signal, sinceCompletion, graceWindow.toMillis());
        return false;
    }

    /**
     * Deletes {@value CheckpointRecord#ERROR_CHANNEL} writes from checkpoints
     * whose run completed naturally.
     *
     * @return number of writes removed
     */
    public CompletableFuture<Integer> cleanupFalseErrors() {
        return checkpointPort.listAll().thenCompose(checkpoints -> {
            List<CompletableFuture<Integer>> deletions = new ArrayList<>();
            for (CheckpointRecord checkpoint : checkpoints) {
                if (checkpoint.isCompletedNaturally() && checkpoint.hasWritesOn(CheckpointRecord.ERROR_CHANNEL)) {
                    deletions.add(checkpointPort.deleteWrites(checkpoint.getThreadId(),
                            checkpoint.getCheckpointId(), CheckpointRecord.ERROR_CHANNEL));
                }
            }
            return CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> deletions.stream().mapToInt(CompletableFuture::join).sum());
        }).whenComplete((deleted, error) -> {
            if (error != null) {
                log.error("[Checkpoint] False error cleanup failed", error);
            } else if (deleted > 0) {
                log.info("[Checkpoint] Cleaned up {} false error writes", deleted);
            } else {
                log.debug("[Checkpoint] No false error writes found");
            }
        });
    }

    /**
     * Deletes checkpoints older than {@code retentionDays}.
     *
     * @return number of checkpoints removed
     */
    public CompletableFuture<Integer> cleanupOldCheckpoints(int retentionDays) {
        if (retentionDays <= 0) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Retention days must be positive, got " + retentionDays));
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        return checkpointPort.deleteOlderThan(cutoff).whenComplete((deleted, error) -> {
            if (error != null) {
                log.error("[Checkpoint] Old checkpoint cleanup failed", error);
            } else {
                log.info("[Checkpoint] Deleted {} checkpoints older than {} days", deleted, retentionDays);
            }
        });
    }
}
