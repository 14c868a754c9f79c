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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.model.RunRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validates client input and builds {@link RunRequest}s. Validation messages
 * are on the client-safe whitelist of {@link ErrorSanitizer}.
 */
@Component
@RequiredArgsConstructor
public class RunRequestFactory {

    static final int MAX_MESSAGE_LENGTH = 100_000;
    static final int MAX_METADATA_BYTES = 10 * 1024;
    static final int MAX_METADATA_DEPTH = 5;

    private static final Pattern THREAD_ID_PATTERN = Pattern.compile("^(?!\\.+$)[A-Za-z0-9._:@-]{1,128}$");

    private final ObjectMapper objectMapper;

    public RunRequest create(String message, String threadId, String requestId, String agentName,
            Map<String, Object> metadata, String transport) {
        if (message == null) {
            throw new RunValidationException("Required field missing");
        }
        String text = message.strip();
        if (text.isEmpty()) {
            throw new RunValidationException("Message cannot be empty");
        }
        if (text.length() > MAX_MESSAGE_LENGTH) {
            throw new RunValidationException("Message is too long");
        }
        String thread = requireThreadId(threadId);
        validateMetadata(metadata);

        String runId = requestId != null && !requestId.isBlank() ? requestId.strip() : UUID.randomUUID().toString();
        return RunRequest.builder()
                .threadId(thread)
                .runId(runId)
                .message(text)
                .agentName(agentName)
                .transport(transport)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
    }

    /**
     * Validates a client-supplied thread id.
     *
     * @return the stripped thread id
     */
    public String requireThreadId(String threadId) {
        if (threadId == null) {
            throw new RunValidationException("Thread ID is required");
        }
        String thread = threadId.strip();
        if (thread.isEmpty()) {
            throw new RunValidationException("Thread ID cannot be empty");
        }
        if (!THREAD_ID_PATTERN.matcher(thread).matches()) {
            throw new RunValidationException("Thread ID has invalid format");
        }
        return thread;
    }

    private void validateMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            return;
        }
        if (depthOf(metadata, 1) > MAX_METADATA_DEPTH) {
            throw new RunValidationException("Invalid request format");
        }
        try {
            byte[] serialized = objectMapper.writeValueAsString(metadata).getBytes(StandardCharsets.UTF_8);
            if (serialized.length > MAX_METADATA_BYTES) {
                throw new RunValidationException("Invalid request format");
            }
        } catch (JsonProcessingException e) {
            throw new RunValidationException("Invalid request format");
        }
    }

    private int depthOf(Object value, int depth) {
        if (depth > MAX_METADATA_DEPTH) {
            return depth;
        }
        int max = depth;
        if (value instanceof Map<?, ?> map) {
            for (Object nested : map.values()) {
                if (nested instanceof Map<?, ?> || nested instanceof Collection<?>) {
                    max = Math.max(max, depthOf(nested, depth + 1));
                }
            }
        } else if (value instanceof Collection<?> collection) {
            for (Object nested : collection) {
                if (nested instanceof Map<?, ?> || nested instanceof Collection<?>) {
                    max = Math.max(max, depthOf(nested, depth + 1));
                }
            }
        }
        return max;
    }
}
