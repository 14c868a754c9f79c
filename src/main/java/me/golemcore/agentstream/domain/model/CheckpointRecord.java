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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted snapshot of a thread's state, owned by the checkpoint store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointRecord {

    public static final String ERROR_CHANNEL = "__error__";
    public static final String INTERRUPT_CHANNEL = "__interrupt__";
    public static final String HUMAN_CHANNEL = "human";
    public static final String METADATA_COMPLETED_NATURALLY = "completed_naturally";
    public static final String METADATA_RUN_ID = "run_id";

    private String threadId;
    private String checkpointId;
    private Instant createdAt;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> state = new LinkedHashMap<>();

    @Builder.Default
    private List<CheckpointWrite> writes = new ArrayList<>();

    @JsonIgnore
    public boolean isCompletedNaturally() {
        return metadata != null && Boolean.TRUE.equals(metadata.get(METADATA_COMPLETED_NATURALLY));
    }

    @JsonIgnore
    public String getRunId() {
        Object runId = metadata != null ? metadata.get(METADATA_RUN_ID) : null;
        return runId != null ? runId.toString() : null;
    }

    public boolean hasWritesOn(String channel) {
        return writes != null && writes.stream().anyMatch(write -> channel.equals(write.getChannel()));
    }
}
