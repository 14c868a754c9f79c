package me.golemcore.agentstream.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentstream.domain.exception.TimeoutConfigurationException;
import me.golemcore.agentstream.domain.model.TimeoutHierarchy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class AutoConfigurationTest {

    @SuppressWarnings("unchecked")
    private final ObjectProvider<BuildProperties> buildProperties = mock(ObjectProvider.class);

    @Test
    void shouldBuildTimeoutHierarchyFromDefaults() {
        AgentStreamProperties properties = new AgentStreamProperties();
        AutoConfiguration configuration = new AutoConfiguration(properties, buildProperties);

        TimeoutHierarchy hierarchy = configuration.timeoutHierarchy(properties);

        assertEquals(Duration.ofSeconds(60), hierarchy.getConnection().deadline());
        assertEquals(Duration.ofSeconds(300), hierarchy.getStream().deadline());
    }

    @Test
    void shouldRefuseToStartWithInvertedTimeouts() {
        AgentStreamProperties properties = new AgentStreamProperties();
        properties.getTimeouts().setTool(Duration.ofSeconds(600));
        AutoConfiguration configuration = new AutoConfiguration(properties, buildProperties);

        TimeoutConfigurationException ex = assertThrows(TimeoutConfigurationException.class,
                () -> configuration.timeoutHierarchy(properties));

        assertTrue(ex.getMessage().contains("tool"));
    }

    @Test
    void shouldWriteInstantsAsIsoStrings() throws JsonProcessingException {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-01-02T03:04:05Z")));

        assertEquals("{\"at\":\"2026-01-02T03:04:05Z\"}", json);
    }

    @Test
    void shouldIgnoreUnknownPropertiesOnRead() throws JsonProcessingException {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        AgentStreamProperties.FeatureProperties features = mapper.readValue(
                "{\"hitlEnabled\":false,\"unknown\":1}", AgentStreamProperties.FeatureProperties.class);

        assertFalse(features.isHitlEnabled());
    }
}
