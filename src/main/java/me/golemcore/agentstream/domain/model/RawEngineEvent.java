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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress event as produced by the agent execution engine, before
 * normalization.
 *
 * <p>
 * {@code data} holds engine-specific entries such as {@code chunk},
 * {@code input}, {@code output} and {@code error}; values may be arbitrary
 * objects. An event with no {@code parentIds} belongs to the root unit of work.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawEngineEvent {

    public static final String CHAIN_START = "on_chain_start";
    public static final String CHAIN_END = "on_chain_end";
    public static final String CHAT_MODEL_START = "on_chat_model_start";
    public static final String CHAT_MODEL_STREAM = "on_chat_model_stream";
    public static final String CHAT_MODEL_END = "on_chat_model_end";
    public static final String TOOL_START = "on_tool_start";
    public static final String TOOL_END = "on_tool_end";
    public static final String TOOL_ERROR = "on_tool_error";

    public static final String DATA_CHUNK = "chunk";
    public static final String DATA_INPUT = "input";
    public static final String DATA_OUTPUT = "output";
    public static final String DATA_ERROR = "error";
    public static final String METADATA_TRACE_ID = "trace_id";

    private String kind;
    private String name;
    private String runId;

    @Builder.Default
    private List<String> parentIds = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public boolean isRoot() {
        return parentIds == null || parentIds.isEmpty();
    }

    public Object dataValue(String key) {
        return data != null ? data.get(key) : null;
    }
}
