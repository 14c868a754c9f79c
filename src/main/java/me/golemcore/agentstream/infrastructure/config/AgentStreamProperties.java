package me.golemcore.agentstream.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent-stream.*} prefix:
 * <ul>
 * <li>{@link TimeoutProperties} - connection, stream and tool timeouts</li>
 * <li>{@link StreamProperties} - heartbeat, websocket path, event
 * allow-list</li>
 * <li>{@link CheckpointProperties} - race grace window and cleanup</li>
 * <li>{@link EngineProperties} - default agent engine (langchain4j)</li>
 * <li>{@link StorageProperties} - local checkpoint storage</li>
 * </ul>
 *
 * <p>
 * Timeout values are validated against the timeout hierarchy at startup, see
 * {@link AutoConfiguration#timeoutHierarchy(AgentStreamProperties)}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent-stream")
@Data
public class AgentStreamProperties {

    private String env = "local";
    private String apiVersion = "v1";
    private TimeoutProperties timeouts = new TimeoutProperties();
    private StreamProperties stream = new StreamProperties();
    private CheckpointProperties checkpoint = new CheckpointProperties();
    private FeatureProperties features = new FeatureProperties();
    private StorageProperties storage = new StorageProperties();
    private EngineProperties engine = new EngineProperties();

    @Data
    public static class TimeoutProperties {
        private Duration connection = Duration.ofSeconds(60);
        private Duration stream = Duration.ofSeconds(300);
        private Duration tool = Duration.ofSeconds(45);
        private Duration webSearch = Duration.ofSeconds(30);
        private List<String> webSearchTools = new ArrayList<>(List.of("web_search", "search"));
    }

    @Data
    public static class StreamProperties {
        private Duration heartbeatInterval = Duration.ofSeconds(5);
        private String websocketPath = "/api/v1/ws";
        private List<String> allowedEvents = new ArrayList<>(List.of(
                "on_chat_model_start",
                "on_chat_model_stream",
                "on_chat_model_end",
                "on_tool_start",
                "on_tool_end",
                "on_tool_error",
                "on_chain_start",
                "on_chain_end"));
    }

    @Data
    public static class CheckpointProperties {
        private Duration graceWindow = Duration.ofMillis(500);
        private int retentionDays = 30;
        private Duration cleanupInterval = Duration.ofHours(1);
        private boolean cleanupEnabled = true;
    }

    @Data
    public static class FeatureProperties {
        private boolean hitlEnabled = true;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/agent-stream";
    }

    @Data
    public static class EngineProperties {
        private String defaultAgent = "general";
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private int maxHistoryMessages = 40;
    }
}
