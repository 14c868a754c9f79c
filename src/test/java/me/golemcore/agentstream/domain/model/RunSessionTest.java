package me.golemcore.agentstream.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunSessionTest {

    private RunSession session;

    @BeforeEach
    void setUp() {
        session = new RunSession("thread-1", "run-1", Instant.EPOCH);
    }

    @Test
    void shouldStartPendingAndMoveForwardOnly() {
        assertEquals(RunState.PENDING, session.getState());

        assertTrue(session.transition(RunState.STREAMING));
        assertFalse(session.transition(RunState.PENDING));
        assertTrue(session.transition(RunState.CANCELLED));

        assertFalse(session.transition(RunState.COMPLETED));
        assertFalse(session.transition(RunState.ERROR));
        assertEquals(RunState.CANCELLED, session.getState());
    }

    @Test
    void shouldAllowTerminalStateDirectlyFromPending() {
        assertTrue(session.transition(RunState.ERROR));
        assertTrue(session.isTerminal());
    }

    @Test
    void shouldCountFilteredEventsForThisRunOnly() {
        RunSession other = new RunSession("thread-2", "run-2", Instant.EPOCH);

        assertEquals(1, session.recordFiltered());
        assertEquals(2, session.recordFiltered());
        assertEquals(1, other.recordFiltered());
    }

    @Test
    void shouldKeepFirstStopReason() {
        assertTrue(session.requestStop(StopReason.STREAM_TIMEOUT));
        assertFalse(session.requestStop(StopReason.CLIENT_DISCONNECT));

        assertEquals(StopReason.STREAM_TIMEOUT, session.getStopReason().orElseThrow());
    }

    @Test
    void shouldMarkLogicallyCompleteOnce() {
        session.transition(RunState.STREAMING);

        assertTrue(session.markLogicallyComplete(1_000L));
        assertFalse(session.markLogicallyComplete(2_000L));

        assertEquals(1_000L, session.getCompletedAtMillis());
        assertEquals(RunState.COMPLETED, session.getState());
        assertFalse(session.transition(RunState.CANCELLED));
    }

    @Test
    void shouldCountReceivedEventsAndDistinctKinds() {
        session.recordReceived("on_chain_start");
        session.recordReceived("on_chat_model_stream");
        session.recordReceived("on_chat_model_stream");
        session.recordReceived("on_custom_event");

        assertEquals(4, session.getEventsReceived());
        assertEquals(Set.of("on_chain_start", "on_chat_model_stream", "on_custom_event"), session.getEventKinds());
    }

    @Test
    void shouldKeepFirstNonBlankTraceId() {
        session.captureTraceId(" ");
        session.captureTraceId("trace-1");
        session.captureTraceId("trace-2");

        assertEquals("trace-1", session.getTraceId().orElseThrow());
    }

    @Test
    void shouldReportEarliestOpenTool() {
        session.openTool("tool-a", "calculator", 5_000L);
        session.openTool("tool-b", "web_search", 3_000L);

        assertEquals("tool-b", session.earliestOpenTool().orElseThrow().toolRunId());

        session.closeTool("tool-b");
        assertEquals("tool-a", session.earliestOpenTool().orElseThrow().toolRunId());

        session.closeTool("tool-a");
        assertTrue(session.earliestOpenTool().isEmpty());
    }

    @Test
    void shouldIssueIncreasingSequenceNumbers() {
        assertEquals(1L, session.nextSequence());
        assertEquals(2L, session.nextSequence());
    }
}
