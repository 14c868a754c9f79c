package me.golemcore.agentstream.adapter.inbound.web;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WireFrameWriterTest {

    @Test
    void shouldWriteEventDataAndMetadata() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        WireFrameWriter writer = new WireFrameWriter(mapper);

        String frame = writer.write(WireEvent.error("Agent execution was cancelled", "client_disconnect_or_timeout",
                Map.of("thread_id", "t-1", "run_id", "r-1")));

        JsonNode node = mapper.readTree(frame);
        assertEquals("on_error", node.get("event").asText());
        assertEquals("client_disconnect_or_timeout", node.get("data").get("reason").asText());
        assertEquals("t-1", node.get("metadata").get("thread_id").asText());
    }

    @Test
    void shouldFallBackToStaticErrorFrameWhenSerializationFails() throws Exception {
        ObjectMapper mapper = mock(ObjectMapper.class);
        when(mapper.writeValueAsString(any())).thenThrow(new JsonMappingException(null, "cycle"));
        WireFrameWriter writer = new WireFrameWriter(mapper);

        String frame = writer.write(WireEvent.error("boom", null, Map.of()));

        assertEquals(WireFrameWriter.FALLBACK_FRAME, frame);
        JsonNode node = AutoConfiguration.objectMapper().readTree(frame);
        assertEquals("on_error", node.get("event").asText());
    }
}
