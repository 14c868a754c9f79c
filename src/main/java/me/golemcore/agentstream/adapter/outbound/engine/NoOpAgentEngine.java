package me.golemcore.agentstream.adapter.outbound.engine;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.port.outbound.AgentEnginePort;
import reactor.core.publisher.Flux;

/**
 * Engine used when no model provider is configured. Every run fails with a
 * descriptive error, which the coordinator turns into a terminal event.
 */
@Slf4j
public class NoOpAgentEngine implements AgentEnginePort {

    private final String agentName;

    public NoOpAgentEngine(String agentName) {
        this.agentName = agentName;
    }

    @Override
    public String getAgentName() {
        return agentName;
    }

    @Override
    public Flux<RawEngineEvent> stream(RunRequest request) {
        log.warn("NoOpAgentEngine: stream() called - no engine configured for agent {}", agentName);
        return Flux.error(new IllegalStateException("No agent engine configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
