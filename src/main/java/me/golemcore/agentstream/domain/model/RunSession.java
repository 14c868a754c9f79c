package me.golemcore.agentstream.domain.model;

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

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bookkeeping for one run, owned by the coordinator that drives it.
 *
 * <p>
 * Only the run's own signal path writes the counters. State, stop reason and
 * event kinds may be read from a transport thread when the client goes away,
 * so they live in atomic or concurrent holders. The state only moves forward;
 * once terminal it never changes again.
 */
public class RunSession {

    private final String threadId;
    private final String runId;
    private final Instant startedAt;

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.PENDING);
    private final AtomicReference<StopReason> stopReason = new AtomicReference<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger eventsReceived = new AtomicInteger();
    private final AtomicInteger eventsFiltered = new AtomicInteger();
    private final Set<String> eventKinds = new CopyOnWriteArraySet<>();
    private final Map<String, OpenTool> openTools = new ConcurrentHashMap<>();

    private volatile String traceId;
    private volatile int shard;
    private volatile long completedAtMillis = -1L;
    private volatile Throwable failure;

    public RunSession(String threadId, String runId, Instant startedAt) {
        this.threadId = threadId;
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public String getThreadId() {
        return threadId;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public RunState getState() {
        return state.get();
    }

    /**
     * Moves the run to {@code target} if the lifecycle allows it.
     *
     * @return true only for the caller that performed the transition
     */
    public boolean transition(RunState target) {
        RunState current = state.get();
        while (current.canTransitionTo(target)) {
            if (state.compareAndSet(current, target)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    public boolean isTerminal() {
        return state.get().isTerminal();
    }

    public boolean requestStop(StopReason reason) {
        return stopReason.compareAndSet(null, reason);
    }

    public Optional<StopReason> getStopReason() {
        return Optional.ofNullable(stopReason.get());
    }

    /**
     * Records the engine's completion signal. From here on the run is logically
     * complete even if persistence has not settled yet.
     */
    public boolean markLogicallyComplete(long nowMillis) {
        if (completedAtMillis >= 0) {
            return false;
        }
        completedAtMillis = nowMillis;
        return transition(RunState.COMPLETED);
    }

    public boolean isLogicallyComplete() {
        return completedAtMillis >= 0;
    }

    public long getCompletedAtMillis() {
        return completedAtMillis;
    }

    public void recordFailure(Throwable error) {
        if (failure == null) {
            failure = error;
        }
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    public void recordReceived(String kind) {
        eventsReceived.incrementAndGet();
        if (kind != null) {
            eventKinds.add(kind);
        }
    }

    /**
     * @return the number of events filtered out so far, including this one
     */
    public int recordFiltered() {
        return eventsFiltered.incrementAndGet();
    }

    public int getEventsReceived() {
        return eventsReceived.get();
    }

    public Set<String> getEventKinds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(eventKinds));
    }

    public void captureTraceId(String candidate) {
        if (traceId == null && candidate != null && !candidate.isBlank()) {
            traceId = candidate;
        }
    }

    public Optional<String> getTraceId() {
        return Optional.ofNullable(traceId);
    }

    public int getShard() {
        return shard;
    }

    public void advanceShard() {
        shard++;
    }

    public void openTool(String toolRunId, String name, long deadlineMillis) {
        openTools.put(toolRunId, new OpenTool(toolRunId, name, deadlineMillis));
    }

    public void closeTool(String toolRunId) {
        openTools.remove(toolRunId);
    }

    /**
     * Open tool invocation whose deadline comes first, if any.
     */
    public Optional<OpenTool> earliestOpenTool() {
        return openTools.values().stream().min(Comparator.comparingLong(OpenTool::deadlineMillis));
    }

    public record OpenTool(String toolRunId, String name, long deadlineMillis) {
    }
}
