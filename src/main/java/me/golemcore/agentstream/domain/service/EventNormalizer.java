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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.EngineMessage;
import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.SendDirective;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.model.WireEventKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stateless transform from one raw engine event to one wire event.
 *
 * <p>
 * Mapping rules:
 * <ul>
 * <li>{@code on_chat_model_stream} - {@code {chunk: {content, id?,
 * additional_kwargs?, response_metadata?}}}</li>
 * <li>chain and chat model start - {@code {name?, input?}}; end -
 * {@code {name?, output?}}</li>
 * <li>{@code on_tool_start} / {@code on_tool_end} / {@code on_tool_error} -
 * a single {@code on_tool_call} with status {@code running} or
 * {@code completed}</li>
 * <li>messages become {@code {type, content, id?, additional_kwargs?,
 * response_metadata?, name?}}, send directives become
 * {@code {type: "send", node, arg}}</li>
 * </ul>
 * Everything else goes through {@link SafeValues}. Absent optional fields are
 * omitted rather than written as null.
 *
 * <p>
 * {@link #normalize} never throws: if an event cannot be normalized, a minimal
 * event of the same kind with {@code {status: "error", message: "Event
 * serialization failed."}} is returned and only the event kind and data keys
 * are logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNormalizer {

    public static final String SERIALIZATION_FAILED = "Event serialization failed.";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";

    private static final String UNKNOWN_TOOL = "unknown_tool";
    private static final String FIELD_NAME = "name";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_ID = "id";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_ADDITIONAL_KWARGS = "additional_kwargs";
    private static final String FIELD_RESPONSE_METADATA = "response_metadata";

    private final ErrorSanitizer errorSanitizer;

    public WireEvent normalize(RawEngineEvent raw) {
        return normalize(raw, Map.of());
    }

    public WireEvent normalize(RawEngineEvent raw, Map<String, Object> metadata) {
        WireEventKind kind = raw != null ? WireEventKind.fromRawKind(raw.getKind()).orElse(null) : null;
        if (kind == null) {
            log.warn("[Normalizer] Unsupported event kind: {}", raw != null ? raw.getKind() : null);
            return fallback(WireEventKind.ERROR, metadata);
        }
        try {
            return new WireEvent(kind, payloadFor(kind, raw), metadata);
        } catch (RuntimeException e) { // NOSONAR - a single bad event must not break the stream
            log.warn("[Normalizer] Failed to normalize event: kind={}, keys={}, error={}",
                    raw.getKind(), dataKeys(raw), e.getClass().getSimpleName());
            return fallback(kind, metadata);
        }
    }

    /**
     * Normalizes a nested value: messages, send directives, mappings and
     * sequences are expanded, anything else is summarized.
     */
    public Object normalizeValue(Object value) {
        return SafeValues.coerce(value, this::normalizeDomainValue, 0);
    }

    private Map<String, Object> payloadFor(WireEventKind kind, RawEngineEvent raw) {
        switch (kind) {
        case CHAT_MODEL_STREAM:
            return Map.of(RawEngineEvent.DATA_CHUNK, chunkPayload(raw.dataValue(RawEngineEvent.DATA_CHUNK)));
        case CHAIN_START:
        case CHAT_MODEL_START:
            return lifecyclePayload(raw, RawEngineEvent.DATA_INPUT);
        case CHAIN_END:
        case CHAT_MODEL_END:
            return lifecyclePayload(raw, RawEngineEvent.DATA_OUTPUT);
        case TOOL_CALL:
            return toolPayload(raw);
        case ERROR:
        default:
            return errorPayload(raw);
        }
    }

    private Map<String, Object> chunkPayload(Object chunk) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (chunk instanceof EngineMessage message) {
            payload.put(FIELD_CONTENT, contentOf(message.getContent()));
            putIfPresent(payload, FIELD_ID, message.getId());
            putIfNotEmpty(payload, FIELD_ADDITIONAL_KWARGS, message.getAdditionalKwargs());
            putIfNotEmpty(payload, FIELD_RESPONSE_METADATA, message.getResponseMetadata());
        } else if (chunk instanceof Map<?, ?> map) {
            payload.put(FIELD_CONTENT, contentOf(map.get(FIELD_CONTENT)));
            putIfPresent(payload, FIELD_ID, map.get(FIELD_ID));
            putIfNotEmpty(payload, FIELD_ADDITIONAL_KWARGS, map.get(FIELD_ADDITIONAL_KWARGS));
            putIfNotEmpty(payload, FIELD_RESPONSE_METADATA, map.get(FIELD_RESPONSE_METADATA));
        } else {
            payload.put(FIELD_CONTENT, contentOf(chunk));
        }
        return payload;
    }

    private Map<String, Object> lifecyclePayload(RawEngineEvent raw, String dataKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        putIfPresent(payload, FIELD_NAME, raw.getName());
        putIfPresent(payload, dataKey, raw.dataValue(dataKey));
        return payload;
    }

    private Map<String, Object> toolPayload(RawEngineEvent raw) {
        Map<String, Object> payload = new LinkedHashMap<>();
        putIfPresent(payload, FIELD_ID, raw.getRunId());
        payload.put(FIELD_NAME, raw.getName() != null ? raw.getName() : UNKNOWN_TOOL);
        if (RawEngineEvent.TOOL_START.equals(raw.getKind())) {
            payload.put(FIELD_STATUS, STATUS_RUNNING);
            putIfPresent(payload, RawEngineEvent.DATA_INPUT, raw.dataValue(RawEngineEvent.DATA_INPUT));
        } else if (RawEngineEvent.TOOL_ERROR.equals(raw.getKind())) {
            payload.put(FIELD_STATUS, STATUS_COMPLETED);
            payload.put(RawEngineEvent.DATA_OUTPUT, toolErrorDescription(raw.dataValue(RawEngineEvent.DATA_ERROR)));
        } else {
            payload.put(FIELD_STATUS, STATUS_COMPLETED);
            putIfPresent(payload, RawEngineEvent.DATA_OUTPUT, raw.dataValue(RawEngineEvent.DATA_OUTPUT));
        }
        return payload;
    }

    private Map<String, Object> errorPayload(RawEngineEvent raw) {
        Object error = raw.dataValue(RawEngineEvent.DATA_ERROR);
        Map<String, Object> payload = new LinkedHashMap<>();
        if (error instanceof Throwable throwable) {
            payload.put(WireEvent.FIELD_ERROR, errorSanitizer.describe(throwable));
        } else {
            payload.put(WireEvent.FIELD_ERROR, error != null ? normalizeValue(error) : "Unknown error");
        }
        putIfPresent(payload, WireEvent.FIELD_REASON, raw.dataValue(WireEvent.FIELD_REASON));
        return payload;
    }

    private String toolErrorDescription(Object error) {
        if (error instanceof Throwable throwable) {
            return "Error: " + errorSanitizer.describe(throwable);
        }
        if (error == null) {
            return "Error: tool execution failed";
        }
        Object normalized = normalizeValue(error);
        return "Error: " + errorSanitizer.sanitize(normalized instanceof String text ? text : normalized.toString());
    }

    private Object normalizeDomainValue(Object value, int depth) {
        if (value instanceof EngineMessage message) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(FIELD_TYPE, roleOf(message));
            result.put(FIELD_CONTENT, SafeValues.coerce(message.getContent(), this::normalizeDomainValue, depth + 1));
            putIfPresent(result, FIELD_ID, message.getId());
            putIfNotEmpty(result, FIELD_ADDITIONAL_KWARGS,
                    SafeValues.coerce(message.getAdditionalKwargs(), this::normalizeDomainValue, depth + 1));
            putIfNotEmpty(result, FIELD_RESPONSE_METADATA,
                    SafeValues.coerce(message.getResponseMetadata(), this::normalizeDomainValue, depth + 1));
            putIfPresent(result, FIELD_NAME, message.getName());
            return result;
        }
        if (value instanceof SendDirective directive) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(FIELD_TYPE, "send");
            result.put("node", directive.node());
            result.put("arg", SafeValues.coerce(directive.arg(), this::normalizeDomainValue, depth + 1));
            return result;
        }
        return null;
    }

    private String roleOf(EngineMessage message) {
        String role = message.getRole();
        return role != null ? role.toLowerCase(Locale.ROOT) : "unknown";
    }

    private Object contentOf(Object content) {
        if (content == null) {
            return "";
        }
        return normalizeValue(content);
    }

    private void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, normalizeValue(value));
        }
    }

    private void putIfNotEmpty(Map<String, Object> target, String key, Object value) {
        if (value instanceof Map<?, ?> map && map.isEmpty()) {
            return;
        }
        putIfPresent(target, key, value);
    }

    private WireEvent fallback(WireEventKind kind, Map<String, Object> metadata) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (kind == WireEventKind.ERROR) {
            payload.put(WireEvent.FIELD_ERROR, SERIALIZATION_FAILED);
        }
        payload.put(FIELD_STATUS, "error");
        payload.put("message", SERIALIZATION_FAILED);
        return new WireEvent(kind, payload, metadata);
    }

    private List<String> dataKeys(RawEngineEvent raw) {
        try {
            return raw.getData() != null ? new ArrayList<>(raw.getData().keySet()) : List.of();
        } catch (RuntimeException e) { // NOSONAR - keys are diagnostic only
            return List.of();
        }
    }
}
