package me.golemcore.agentstream.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentstream.adapter.inbound.web.WireFrameWriter;
import me.golemcore.agentstream.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agentstream.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.agentstream.adapter.inbound.web.filter.RequestIdWebFilter;
import me.golemcore.agentstream.domain.exception.GatewayTimeoutException;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.model.RunCancellation;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.domain.model.TimeoutHierarchy;
import me.golemcore.agentstream.domain.model.WireEvent;
import me.golemcore.agentstream.domain.model.WireEventKind;
import me.golemcore.agentstream.domain.service.RunRequestFactory;
import me.golemcore.agentstream.domain.service.StreamCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StreamCoordinator streamCoordinator;
    private VirtualTimeScheduler scheduler;
    private ChatController controller;
    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        streamCoordinator = mock(StreamCoordinator.class);
        scheduler = VirtualTimeScheduler.create();
        TimeoutHierarchy timeouts = TimeoutHierarchy.of(Duration.ofSeconds(60), Duration.ofSeconds(300),
                Duration.ofSeconds(45), Duration.ofSeconds(30), List.of("web_search"));
        controller = new ChatController(streamCoordinator, new RunRequestFactory(objectMapper), timeouts,
                new WireFrameWriter(objectMapper), scheduler);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/chat"));
        exchange.getAttributes().put(RequestIdWebFilter.ATTRIBUTE, "req-1");
    }

    @Test
    void shouldStreamEventsBoundedByConnectionTimeout() {
        when(streamCoordinator.stream(any(RunRequest.class), any(RunCancellation.class), any(Duration.class)))
                .thenReturn(Flux.just(
                        new WireEvent(WireEventKind.CHAIN_START, Map.of("name", "general"), Map.of()),
                        WireEvent.error(StreamCoordinator.CANCELLED_MESSAGE + ": stream timeout exceeded",
                                "timeout", Map.of())));

        StepVerifier.create(controller.stream(chatRequest("hi"), exchange))
                .assertNext(sse -> assertTrue(sse.data().contains("\"event\":\"on_chain_start\"")))
                .assertNext(sse -> assertTrue(sse.data().contains("\"reason\":\"timeout\"")))
                .verifyComplete();

        ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
        verify(streamCoordinator).stream(request.capture(), any(RunCancellation.class), eq(Duration.ofSeconds(60)));
        assertEquals("req-1", request.getValue().getRunId());
        assertEquals(ChatController.TRANSPORT_SSE, request.getValue().getTransport());
    }

    @Test
    void shouldAggregateStreamedContent() {
        when(streamCoordinator.stream(any(RunRequest.class), any(RunCancellation.class)))
                .thenReturn(Flux.just(
                        new WireEvent(WireEventKind.CHAIN_START, Map.of(), Map.of()),
                        chunk("Hel"),
                        chunk("lo"),
                        new WireEvent(WireEventKind.CHAIN_END, Map.of(), Map.of())));

        StepVerifier.create(controller.chat(chatRequest("hi"), exchange))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ChatResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("t-1", body.getThreadId());
                    assertEquals("req-1", body.getRunId());
                    assertEquals("completed", body.getStatus());
                    assertEquals("Hello", body.getContent());
                    assertEquals(4, body.getEvents());
                    assertNull(body.getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportEngineFailureInAggregate() {
        when(streamCoordinator.stream(any(RunRequest.class), any(RunCancellation.class)))
                .thenReturn(Flux.just(chunk("par"), WireEvent.error(StreamCoordinator.FAILED_MESSAGE,
                        StreamCoordinator.REASON_ENGINE_ERROR, Map.of())));

        StepVerifier.create(controller.chat(chatRequest("hi"), exchange))
                .assertNext(response -> {
                    assertEquals("error", response.getBody().getStatus());
                    assertEquals(StreamCoordinator.FAILED_MESSAGE, response.getBody().getError());
                    assertEquals("par", response.getBody().getContent());
                })
                .verifyComplete();
    }

    @Test
    void shouldFailWithGatewayTimeoutWhenConnectionTimeoutExpires() {
        when(streamCoordinator.stream(any(RunRequest.class), any(RunCancellation.class))).thenReturn(Flux.never());

        StepVerifier.withVirtualTime(() -> controller.chat(chatRequest("hi"), exchange), () -> scheduler,
                Long.MAX_VALUE)
                .thenAwait(Duration.ofSeconds(60))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof GatewayTimeoutException);
                    assertEquals("Request exceeded 60s timeout limit", error.getMessage());
                })
                .verify();
    }

    @Test
    void shouldRejectInvalidRequestBeforeStreaming() {
        assertThrows(RunValidationException.class, () -> controller.chat(chatRequest(""), exchange));
        assertThrows(RunValidationException.class, () -> controller.stream(null, exchange));
    }

    private ChatRequest chatRequest(String message) {
        return ChatRequest.builder().message(message).threadId("t-1").build();
    }

    private WireEvent chunk(String content) {
        return new WireEvent(WireEventKind.CHAT_MODEL_STREAM, Map.of("chunk", Map.of("content", content)), Map.of());
    }
}
