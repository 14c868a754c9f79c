package me.golemcore.agentstream.domain.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import me.golemcore.agentstream.domain.model.CheckpointRecord;
import me.golemcore.agentstream.domain.model.CheckpointWrite;
import me.golemcore.agentstream.domain.model.RunSession;
import me.golemcore.agentstream.domain.model.RunState;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.CheckpointPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CheckpointRaceGuardTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private CheckpointPort checkpointPort;
    private CheckpointRaceGuard raceGuard;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        checkpointPort = mock(CheckpointPort.class);
        when(checkpointPort.markRunCompleted(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(1));
        AgentStreamProperties properties = new AgentStreamProperties();
        properties.getCheckpoint().setGraceWindow(Duration.ofMillis(500));
        raceGuard = new CheckpointRaceGuard(checkpointPort, Clock.fixed(NOW, ZoneOffset.UTC), properties);

        logger = (Logger) LoggerFactory.getLogger(CheckpointRaceGuard.class);
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(null);
    }

    @Test
    void shouldMarkRunCompletedOnce() {
        RunSession session = streamingSession();

        raceGuard.markCompleted(session, 1_000L);
        raceGuard.markCompleted(session, 1_200L);

        assertEquals(RunState.COMPLETED, session.getState());
        assertEquals(1_000L, session.getCompletedAtMillis());
        verify(checkpointPort, times(1)).markRunCompleted("thread-1", "run-1");
    }

    @Test
    void shouldKeepCompletionWhenStoreFails() {
        when(checkpointPort.markRunCompleted(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        RunSession session = streamingSession();

        raceGuard.markCompleted(session, 1_000L);

        assertTrue(session.isLogicallyComplete());
        assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("Failed to mark run completed")));
    }

    @Test
    void shouldSuppressSignalInsideGraceWindowAtDebug() {
        RunSession session = streamingSession();
        raceGuard.markCompleted(session, 1_000L);

        boolean inside = raceGuard.absorbPostCompletionSignal(session, "CLIENT_DISCONNECT", 1_050L);

        assertTrue(inside);
        ILoggingEvent last = appender.list.get(appender.list.size() - 1);
        assertEquals(Level.DEBUG, last.getLevel());
        assertTrue(last.getFormattedMessage().contains("Suppressed post-completion race"));
    }

    @Test
    void shouldWarnForSignalOutsideGraceWindow() {
        RunSession session = streamingSession();
        raceGuard.markCompleted(session, 1_000L);

        boolean inside = raceGuard.absorbPostCompletionSignal(session, "IllegalStateException: late", 2_000L);

        assertFalse(inside);
        ILoggingEvent last = appender.list.get(appender.list.size() - 1);
        assertEquals(Level.WARN, last.getLevel());
        assertEquals(RunState.COMPLETED, session.getState());
    }

    @Test
    void shouldDeleteErrorWritesOfNaturallyCompletedCheckpointsOnly() {
        CheckpointRecord falseError = checkpoint("cp-1", true, CheckpointRecord.ERROR_CHANNEL);
        CheckpointRecord realError = checkpoint("cp-2", false, CheckpointRecord.ERROR_CHANNEL);
        CheckpointRecord clean = checkpoint("cp-3", true, "messages");
        when(checkpointPort.listAll()).thenReturn(CompletableFuture.completedFuture(
                List.of(falseError, realError, clean)));
        when(checkpointPort.deleteWrites("thread-1", "cp-1", CheckpointRecord.ERROR_CHANNEL))
                .thenReturn(CompletableFuture.completedFuture(1));

        int deleted = raceGuard.cleanupFalseErrors().join();

        assertEquals(1, deleted);
        verify(checkpointPort, never()).deleteWrites("thread-1", "cp-2", CheckpointRecord.ERROR_CHANNEL);
        verify(checkpointPort, never()).deleteWrites("thread-1", "cp-3", CheckpointRecord.ERROR_CHANNEL);
    }

    @Test
    void shouldDeleteCheckpointsOlderThanRetention() {
        when(checkpointPort.deleteOlderThan(any())).thenReturn(CompletableFuture.completedFuture(4));

        int deleted = raceGuard.cleanupOldCheckpoints(30).join();

        assertEquals(4, deleted);
        verify(checkpointPort).deleteOlderThan(NOW.minus(Duration.ofDays(30)));
    }

    @Test
    void shouldRejectNonPositiveRetention() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> raceGuard.cleanupOldCheckpoints(0).join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        verify(checkpointPort, never()).deleteOlderThan(any());
    }

    private RunSession streamingSession() {
        RunSession session = new RunSession("thread-1", "run-1", NOW);
        session.transition(RunState.STREAMING);
        return session;
    }

    private CheckpointRecord checkpoint(String id, boolean completedNaturally, String channel) {
        return CheckpointRecord.builder()
                .threadId("thread-1")
                .checkpointId(id)
                .createdAt(NOW)
                .metadata(new LinkedHashMap<>(Map.of(
                        CheckpointRecord.METADATA_COMPLETED_NATURALLY, completedNaturally)))
                .writes(List.of(CheckpointWrite.builder().taskId("task").channel(channel).value("x").build()))
                .build();
    }
}
