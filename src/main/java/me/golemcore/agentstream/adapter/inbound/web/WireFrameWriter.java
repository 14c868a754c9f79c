package me.golemcore.agentstream.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.service.EventNormalizer;
import org.springframework.stereotype.Component;

/**
 * Serializes wire events into the JSON text of one frame.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WireFrameWriter {

    static final String FALLBACK_FRAME = "{\"event\":\"on_error\",\"data\":{\"error\":\""
            + EventNormalizer.SERIALIZATION_FAILED + "\",\"status\":\"error\",\"message\":\""
            + EventNormalizer.SERIALIZATION_FAILED + "\"}}";

    private final ObjectMapper objectMapper;

    public String write(WireEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[WebSocket] Failed to serialize wire event: kind={}, keys={}", event.kind(),
                    event.payload().keySet());
            return FALLBACK_FRAME;
        }
    }
}
