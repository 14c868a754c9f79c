package me.golemcore.agentstream;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the agent stream gateway.
 *
 * <p>
 * The gateway exposes a long-running agent execution engine to remote clients
 * and turns the engine's raw progress events into a stable wire protocol.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → WebSocketChatHandler, ChatController (SSE / invoke)
 * Domain Layer       → StreamCoordinator, EventNormalizer, CheckpointRaceGuard
 * Infrastructure     → Engine (langchain4j) and checkpoint storage adapters
 * </pre>
 *
 * <p>
 * Every run ends with exactly one terminal wire event, whether the engine
 * finishes, fails, times out or the client goes away.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentStreamApplication.class, args);
    }
}
