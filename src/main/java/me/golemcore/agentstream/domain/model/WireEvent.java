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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized, JSON-safe unit of progress delivered to a client.
 *
 * <p>
 * Serialized as {@code {"event": kind, "data": payload, "metadata": {...}}}.
 * The payload only ever contains maps with string keys, lists, strings, numbers,
 * booleans and nulls.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record WireEvent(
        @JsonProperty("event") WireEventKind kind,
        @JsonProperty("data") Map<String, Object> payload,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static final String FIELD_ERROR = "error";
    public static final String FIELD_REASON = "reason";

    public WireEvent {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static WireEvent error(String error, String reason, Map<String, Object> metadata) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_ERROR, error);
        if (reason != null) {
            payload.put(FIELD_REASON, reason);
        }
        return new WireEvent(WireEventKind.ERROR, payload, metadata);
    }

    @JsonIgnore
    public boolean isError() {
        return kind == WireEventKind.ERROR;
    }

    @JsonIgnore
    public String reason() {
        Object reason = payload.get(FIELD_REASON);
        return reason instanceof String value ? value : null;
    }
}
