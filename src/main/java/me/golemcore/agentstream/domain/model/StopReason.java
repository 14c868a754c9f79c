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

/**
 * Why a run was asked to stop before the engine finished.
 */
public enum StopReason {

    CLIENT_DISCONNECT("client_disconnect_or_timeout"),
    ABORTED("client_disconnect_or_timeout"),
    STREAM_TIMEOUT("timeout"),
    TOOL_TIMEOUT("timeout");

    private final String wireReason;

    StopReason(String wireReason) {
        this.wireReason = wireReason;
    }

    /**
     * Value of the {@code reason} field in the terminal {@code on_error}
     * event.
     */
    public String getWireReason() {
        return wireReason;
    }

    public boolean isTimeout() {
        return this == STREAM_TIMEOUT || this == TOOL_TIMEOUT;
    }
}
