package me.golemcore.agentstream.domain.service;

import me.golemcore.agentstream.domain.model.EngineMessage;
import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.SendDirective;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.model.WireEventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventNormalizerTest {

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(new ErrorSanitizer());
    }

    @Test
    void shouldNormalizeStreamChunkMessage() {
        EngineMessage chunk = EngineMessage.builder().role("ai").content("Hel").id("msg-1").build();
        RawEngineEvent raw = event(RawEngineEvent.CHAT_MODEL_STREAM, "gpt", RawEngineEvent.DATA_CHUNK, chunk);

        WireEvent event = normalizer.normalize(raw);

        assertEquals(WireEventKind.CHAT_MODEL_STREAM, event.kind());
        assertEquals(Map.of("chunk", Map.of("content", "Hel", "id", "msg-1")), event.payload());
    }

    @Test
    void shouldNormalizePlainChunkAsContent() {
        RawEngineEvent raw = event(RawEngineEvent.CHAT_MODEL_STREAM, "gpt", RawEngineEvent.DATA_CHUNK, "lo");

        assertEquals(Map.of("chunk", Map.of("content", "lo")), normalizer.normalize(raw).payload());
    }

    @Test
    void shouldNormalizeChainEndOutputMessages() {
        EngineMessage reply = EngineMessage.builder()
                .role("AI")
                .content("Hello")
                .responseMetadata(Map.of("finish_reason", "stop"))
                .build();
        RawEngineEvent raw = event(RawEngineEvent.CHAIN_END, "general", RawEngineEvent.DATA_OUTPUT,
                Map.of("messages", List.of(reply)));

        WireEvent event = normalizer.normalize(raw);

        Map<?, ?> output = (Map<?, ?>) event.payload().get("output");
        Map<?, ?> message = (Map<?, ?>) ((List<?>) output.get("messages")).get(0);
        assertEquals("general", event.payload().get("name"));
        assertEquals("ai", message.get("type"));
        assertEquals("Hello", message.get("content"));
        assertEquals(Map.of("finish_reason", "stop"), message.get("response_metadata"));
        assertFalse(message.containsKey("additional_kwargs"));
    }

    @Test
    void shouldNormalizeSendDirectives() {
        RawEngineEvent raw = event(RawEngineEvent.CHAIN_START, "router", RawEngineEvent.DATA_INPUT,
                List.of(new SendDirective("researcher", Map.of("topic", "java"))));

        Object input = normalizer.normalize(raw).payload().get("input");

        assertEquals(List.of(Map.of("type", "send", "node", "researcher", "arg", Map.of("topic", "java"))), input);
    }

    @Test
    void shouldMapToolStartToRunningToolCall() {
        RawEngineEvent raw = event(RawEngineEvent.TOOL_START, "calculator", RawEngineEvent.DATA_INPUT,
                Map.of("expression", "2+2"));
        raw.setRunId("tool-run-1");

        WireEvent event = normalizer.normalize(raw);

        assertEquals(WireEventKind.TOOL_CALL, event.kind());
        assertEquals("tool-run-1", event.payload().get("id"));
        assertEquals("calculator", event.payload().get("name"));
        assertEquals(EventNormalizer.STATUS_RUNNING, event.payload().get("status"));
        assertEquals(Map.of("expression", "2+2"), event.payload().get("input"));
    }

    @Test
    void shouldMapToolErrorToCompletedToolCallWithErrorOutput() {
        RawEngineEvent raw = event(RawEngineEvent.TOOL_ERROR, "web_search", RawEngineEvent.DATA_ERROR,
                new IllegalStateException("upstream unavailable"));

        WireEvent event = normalizer.normalize(raw);

        assertEquals(WireEventKind.TOOL_CALL, event.kind());
        assertEquals(EventNormalizer.STATUS_COMPLETED, event.payload().get("status"));
        assertEquals("Error: IllegalStateException: upstream unavailable", event.payload().get("output"));
    }

    @Test
    void shouldRedactSecretsInToolErrors() {
        RawEngineEvent raw = event(RawEngineEvent.TOOL_ERROR, "http", RawEngineEvent.DATA_ERROR,
                "401 for Bearer abc");

        assertEquals("Error: " + ErrorSanitizer.REDACTED, normalizer.normalize(raw).payload().get("output"));
    }

    @Test
    void shouldNameUnnamedToolsUnknown() {
        RawEngineEvent raw = event(RawEngineEvent.TOOL_END, null, RawEngineEvent.DATA_OUTPUT, "4");

        assertEquals("unknown_tool", normalizer.normalize(raw).payload().get("name"));
    }

    @Test
    void shouldFallBackWithSameKindWhenPayloadAccessFails() {
        Map<String, Object> hostile = new HashMap<>() {
            @Override
            public Object get(Object key) {
                throw new IllegalStateException("broken payload");
            }
        };
        hostile.put("input", "x");
        RawEngineEvent raw = RawEngineEvent.builder()
                .kind(RawEngineEvent.CHAIN_START)
                .name("general")
                .data(hostile)
                .build();

        WireEvent event = normalizer.normalize(raw, Map.of("seq", 1L));

        assertEquals(WireEventKind.CHAIN_START, event.kind());
        assertEquals("error", event.payload().get("status"));
        assertEquals(EventNormalizer.SERIALIZATION_FAILED, event.payload().get("message"));
        assertEquals(Map.of("seq", 1L), event.metadata());
    }

    @Test
    void shouldReturnErrorEventForUnknownKind() {
        RawEngineEvent raw = event("on_retriever_start", "docs", RawEngineEvent.DATA_INPUT, "q");

        WireEvent event = normalizer.normalize(raw);

        assertTrue(event.isError());
        assertEquals(EventNormalizer.SERIALIZATION_FAILED, event.payload().get("error"));
    }

    @Test
    void shouldSummarizeOpaqueValues() {
        RawEngineEvent raw = event(RawEngineEvent.CHAIN_START, "general", RawEngineEvent.DATA_INPUT,
                new StringBuilder("opaque"));

        assertEquals("<StringBuilder: opaque>", normalizer.normalize(raw).payload().get("input"));
    }

    private RawEngineEvent event(String kind, String name, String dataKey, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(dataKey, value);
        return RawEngineEvent.builder()
                .kind(kind)
                .name(name)
                .data(data)
                .build();
    }
}
