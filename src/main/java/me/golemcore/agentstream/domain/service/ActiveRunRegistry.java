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
import me.golemcore.agentstream.domain.model.RunCancellation;
import me.golemcore.agentstream.domain.model.StopReason;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the active run of each transport connection so that disconnects and
 * explicit aborts reach the right cancellation token. A connection runs at most
 * one run at a time.
 */
@Service
@Slf4j
public class ActiveRunRegistry {

    private final Map<String, ActiveRun> runsByConnection = new ConcurrentHashMap<>();

    /**
     * Registers a new run for the connection.
     *
     * @return the run's cancellation token, or empty if the connection already
     *         has an active run
     */
    public Optional<RunCancellation> register(String connectionId, String runId, String threadId) {
        RunCancellation cancellation = new RunCancellation();
        ActiveRun candidate = new ActiveRun(runId, threadId, cancellation);
        ActiveRun existing = runsByConnection.putIfAbsent(connectionId, candidate);
        if (existing != null) {
            log.debug("[Runs] Rejected concurrent run: connectionId={}, activeRunId={}", connectionId,
                    existing.runId());
            return Optional.empty();
        }
        return Optional.of(cancellation);
    }

    /**
     * Removes the run if it is still the active one for the connection.
     */
    public void release(String connectionId, String runId) {
        runsByConnection.computeIfPresent(connectionId,
                (key, active) -> active.runId().equals(runId) ? null : active);
    }

    /**
     * Cancels the connection's active run, if any.
     *
     * @return true if a run was cancelled by this call
     */
    public boolean cancel(String connectionId, StopReason reason) {
        ActiveRun active = runsByConnection.get(connectionId);
        if (active == null) {
            return false;
        }
        boolean cancelled = active.cancellation().cancel(reason);
        if (cancelled) {
            log.info("[Runs] Cancellation requested: connectionId={}, threadId={}, runId={}, reason={}",
                    connectionId, active.threadId(), active.runId(), reason);
        }
        return cancelled;
    }

    public boolean hasActiveRun(String connectionId) {
        return runsByConnection.containsKey(connectionId);
    }

    public int getActiveRunCount() {
        return runsByConnection.size();
    }

    private record ActiveRun(String runId, String threadId, RunCancellation cancellation) {
    }
}
