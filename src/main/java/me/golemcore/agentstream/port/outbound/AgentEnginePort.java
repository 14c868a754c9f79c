package me.golemcore.agentstream.port.outbound;

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

import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.RunRequest;
import reactor.core.publisher.Flux;

/**
 * Port for the agent execution engine. The engine decides what to compute; the
 * gateway only consumes its ordered progress events.
 */
public interface AgentEnginePort {

    /**
     * Name the engine is registered under.
     */
    String getAgentName();

    /**
     * Runs the agent for one request.
     *
     * <p>
     * The returned flux is cold: the run starts on subscription and
     * cancelling the subscription must stop the underlying work.
     */
    Flux<RawEngineEvent> stream(RunRequest request);

    /**
     * Whether the engine is configured well enough to serve runs.
     */
    boolean isAvailable();
}
