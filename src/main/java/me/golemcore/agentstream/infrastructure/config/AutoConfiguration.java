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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.TimeoutHierarchy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Spring configuration for the shared infrastructure beans of the gateway.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock}, Jackson {@link ObjectMapper} and the Reactor
 * {@link Scheduler} used for run deadlines</li>
 * <li>Validates the timeout hierarchy; an invalid configuration fails the
 * context before any traffic is served</li>
 * <li>Logs startup information via {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentStreamProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static Scheduler streamScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public TimeoutHierarchy timeoutHierarchy(AgentStreamProperties agentStreamProperties) {
        AgentStreamProperties.TimeoutProperties timeouts = agentStreamProperties.getTimeouts();
        TimeoutHierarchy hierarchy = TimeoutHierarchy.of(timeouts.getConnection(), timeouts.getStream(),
                timeouts.getTool(), timeouts.getWebSearch(), timeouts.getWebSearchTools());
        log.info("Timeout hierarchy validated: {}", hierarchy.describe());
        return hierarchy;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Agent Stream v{} starting (env={})", version, properties.getEnv());
        log.info("Heartbeat: {}, HITL enabled: {}", properties.getStream().getHeartbeatInterval(),
                properties.getFeatures().isHitlEnabled());
        log.info("Checkpoint grace window: {}, retention: {} days",
                properties.getCheckpoint().getGraceWindow(), properties.getCheckpoint().getRetentionDays());
        log.info("Default agent: {} ({})", properties.getEngine().getDefaultAgent(),
                properties.getEngine().getProvider());
    }
}
