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

import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.service.ErrorSanitizer;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.AgentEngineProvider;
import me.golemcore.agentstream.port.outbound.AgentEnginePort;
import me.golemcore.agentstream.port.outbound.CheckpointPort;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the default agent engine on top of a langchain4j streaming chat model.
 *
 * <p>
 * Uses the OpenAI-compatible API configured under
 * {@code agent-stream.engine.*}. Without an API key the provider falls back to
 * {@link NoOpAgentEngine}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEngineProvider implements AgentEngineProvider {

    private final AgentStreamProperties properties;
    private final CheckpointPort checkpointPort;
    private final ErrorSanitizer errorSanitizer;
    private final Clock clock;

    @Override
    public String getAgentName() {
        return properties.getEngine().getDefaultAgent();
    }

    @Override
    public AgentEnginePort create() {
        AgentStreamProperties.EngineProperties engine = properties.getEngine();
        if (engine.getApiKey() == null || engine.getApiKey().isBlank()) {
            log.warn("[Engine] No API key configured for provider '{}', using no-op engine", engine.getProvider());
            return new NoOpAgentEngine(getAgentName());
        }
        StreamingChatModel model = createModel(engine);
        log.info("[Engine] Langchain4j engine created: agent={}, model={}", getAgentName(), engine.getModel());
        return new Langchain4jAgentEngine(getAgentName(), engine.getModel(), model, checkpointPort, errorSanitizer,
                clock, engine.getMaxHistoryMessages());
    }

    private StreamingChatModel createModel(AgentStreamProperties.EngineProperties engine) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(engine.getApiKey())
                .modelName(engine.getModel())
                .timeout(properties.getTimeouts().getStream());

        if (engine.getBaseUrl() != null && !engine.getBaseUrl().isBlank()) {
            builder.baseUrl(engine.getBaseUrl());
        }
        return builder.build();
    }
}
