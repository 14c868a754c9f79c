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

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Keeps secrets and internal details out of client-facing error text and logs.
 */
@Component
public class ErrorSanitizer {

    public static final String REDACTED = "[REDACTED: Potential secret in error message]";
    public static final String GENERIC_VALIDATION_MESSAGE = "Validation failed";

    private static final List<String> SECRET_PATTERNS = List.of(
            "sk-", "lsv2_", "ls__", "key=", "token=", "password=", "api_key=", "secret=", "Bearer ");

    private static final Set<String> SAFE_VALIDATION_MESSAGES = Set.of(
            "Message cannot be empty",
            "Message must not be whitespace only",
            "Message is too long",
            "Thread ID is required",
            "Thread ID cannot be empty",
            "Thread ID has invalid format",
            "Invalid request format",
            "Required field missing",
            "Unknown message type",
            "A run is already active on this connection",
            "Thread ID mismatch",
            "HITL is disabled",
            "response_text cannot be empty",
            "response_text is required for respond action",
            "tool_edits is required for edit action");

    /**
     * Replaces the whole message when it looks like it carries a credential.
     */
    public String sanitize(String message) {
        if (message == null) {
            return null;
        }
        for (String pattern : SECRET_PATTERNS) {
            if (message.contains(pattern)) {
                return REDACTED;
            }
        }
        return message;
    }

    /**
     * Short sanitized description of a failure: exception type and message.
     */
    public String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        if (message == null || message.isBlank()) {
            return type;
        }
        return type + ": " + sanitize(message);
    }

    /**
     * Passes through whitelisted validation messages only.
     */
    public String safeValidationMessage(String message) {
        if (message != null && SAFE_VALIDATION_MESSAGES.contains(message)) {
            return message;
        }
        return GENERIC_VALIDATION_MESSAGE;
    }
}
