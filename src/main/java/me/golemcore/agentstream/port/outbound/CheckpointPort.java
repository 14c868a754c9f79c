package me.golemcore.agentstream.port.outbound;

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

import me.golemcore.agentstream.domain.model.CheckpointRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the checkpoint store: persisted run state keyed by thread.
 */
public interface CheckpointPort {

    /**
     * Store a checkpoint, replacing any checkpoint with the same thread and
     * checkpoint id.
     */
    CompletableFuture<Void> save(CheckpointRecord checkpoint);

    /**
     * Most recent checkpoint of a thread.
     */
    CompletableFuture<Optional<CheckpointRecord>> findLatest(String threadId);

    /**
     * All checkpoints across all threads.
     */
    CompletableFuture<List<CheckpointRecord>> listAll();

    /**
     * Mark every checkpoint written by the given run as naturally completed.
     *
     * @return number of checkpoints updated
     */
    CompletableFuture<Integer> markRunCompleted(String threadId, String runId);

    /**
     * Delete pending writes on {@code channel} from one checkpoint.
     *
     * @return number of writes removed
     */
    CompletableFuture<Integer> deleteWrites(String threadId, String checkpointId, String channel);

    /**
     * Delete checkpoints created before {@code cutoff}.
     *
     * @return number of checkpoints removed
     */
    CompletableFuture<Integer> deleteOlderThan(Instant cutoff);
}
