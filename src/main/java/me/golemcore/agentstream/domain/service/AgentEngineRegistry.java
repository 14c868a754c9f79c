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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.AgentEngineProvider;
import me.golemcore.agentstream.port.outbound.AgentEnginePort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of agent engines keyed by agent name.
 *
 * <p>
 * Engines are built lazily through their {@link AgentEngineProvider} the first
 * time an agent is requested. Construction happens under a single
 * initialization lock and the result is memoized, so each engine is created
 * exactly once even when concurrent runs ask for it at the same time.
 */
@Service
@Slf4j
public class AgentEngineRegistry {

    private final Map<String, AgentEngineProvider> providersByAgent = new LinkedHashMap<>();
    private final Map<String, AgentEnginePort> engines = new ConcurrentHashMap<>();
    private final Object initLock = new Object();
    private final String defaultAgent;

    public AgentEngineRegistry(List<AgentEngineProvider> providers, AgentStreamProperties properties) {
        for (AgentEngineProvider provider : providers) {
            AgentEngineProvider previous = providersByAgent.put(provider.getAgentName(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate agent engine provider: " + provider.getAgentName());
            }
            log.debug("[Engine] Registered agent provider: {}", provider.getAgentName());
        }
        this.defaultAgent = properties.getEngine().getDefaultAgent();
    }

    /**
     * Engine for {@code agentName}, or for the default agent when the name is
     * blank.
     *
     * @throws IllegalArgumentException
     *             if no provider is registered for the agent
     */
    public AgentEnginePort resolve(String agentName) {
        String name = agentName == null || agentName.isBlank() ? defaultAgent : agentName.trim();
        AgentEnginePort engine = engines.get(name);
        if (engine != null) {
            return engine;
        }
        synchronized (initLock) {
            engine = engines.get(name);
            if (engine != null) {
                return engine;
            }
            AgentEngineProvider provider = providersByAgent.get(name);
            if (provider == null) {
                throw new IllegalArgumentException("Unknown agent: " + name);
            }
            engine = provider.create();
            engines.put(name, engine);
            log.info("[Engine] Initialized agent engine: agent={}, available={}", name, engine.isAvailable());
            return engine;
        }
    }

    public Set<String> getAgentNames() {
        return Set.copyOf(providersByAgent.keySet());
    }

    public String getDefaultAgent() {
        return defaultAgent;
    }

    public boolean isInitialized(String agentName) {
        return engines.containsKey(agentName);
    }
}
