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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of event kinds a client can receive on the wire.
 */
public enum WireEventKind {

    CHAIN_START("on_chain_start"),
    CHAIN_END("on_chain_end"),
    CHAT_MODEL_START("on_chat_model_start"),
    CHAT_MODEL_STREAM("on_chat_model_stream"),
    CHAT_MODEL_END("on_chat_model_end"),
    TOOL_CALL("on_tool_call"),
    ERROR("on_error");

    private final String wireName;

    WireEventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Maps a raw engine event kind to the wire kind it is delivered as. Tool
     * start, end and error all collapse into {@link #TOOL_CALL}.
     */
    public static Optional<WireEventKind> fromRawKind(String rawKind) {
        if (rawKind == null) {
            return Optional.empty();
        }
        switch (rawKind) {
        case RawEngineEvent.CHAIN_START:
            return Optional.of(CHAIN_START);
        case RawEngineEvent.CHAIN_END:
            return Optional.of(CHAIN_END);
        case RawEngineEvent.CHAT_MODEL_START:
            return Optional.of(CHAT_MODEL_START);
        case RawEngineEvent.CHAT_MODEL_STREAM:
            return Optional.of(CHAT_MODEL_STREAM);
        case RawEngineEvent.CHAT_MODEL_END:
            return Optional.of(CHAT_MODEL_END);
        case RawEngineEvent.TOOL_START:
        case RawEngineEvent.TOOL_END:
        case RawEngineEvent.TOOL_ERROR:
            return Optional.of(TOOL_CALL);
        case "on_error":
            return Optional.of(ERROR);
        default:
            return Optional.empty();
        }
    }
}
