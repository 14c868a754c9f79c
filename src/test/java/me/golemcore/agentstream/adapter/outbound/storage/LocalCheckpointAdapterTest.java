package me.golemcore.agentstream.adapter.outbound.storage;

import me.golemcore.agentstream.domain.model.CheckpointRecord;
import me.golemcore.agentstream.domain.model.CheckpointWrite;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalCheckpointAdapterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private LocalCheckpointAdapter adapter;

    @BeforeEach
    void setUp() {
        AgentStreamProperties properties = new AgentStreamProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new LocalCheckpointAdapter(properties, AutoConfiguration.objectMapper());
        adapter.init();
    }

    @Test
    void shouldSaveAndFindLatestCheckpointOfThread() {
        adapter.save(checkpoint("thread-1", "cp-1", T0, "run-1")).join();
        adapter.save(checkpoint("thread-1", "cp-2", T0.plusSeconds(10), "run-2")).join();
        adapter.save(checkpoint("thread-2", "cp-3", T0.plusSeconds(20), "run-3")).join();

        Optional<CheckpointRecord> latest = adapter.findLatest("thread-1").join();

        assertEquals("cp-2", latest.orElseThrow().getCheckpointId());
        assertEquals("run-2", latest.get().getRunId());
        assertTrue(Files.exists(tempDir.resolve(LocalCheckpointAdapter.CHECKPOINTS_DIR).resolve("thread-1")
                .resolve("cp-2.json")));
    }

    @Test
    void shouldReturnEmptyForUnknownThread() {
        assertTrue(adapter.findLatest("nobody").join().isEmpty());
    }

    @Test
    void shouldMarkOnlyMatchingRunCompleted() {
        adapter.save(checkpoint("thread-1", "cp-1", T0, "run-1")).join();
        adapter.save(checkpoint("thread-1", "cp-2", T0.plusSeconds(1), "run-2")).join();

        int updated = adapter.markRunCompleted("thread-1", "run-2").join();

        assertEquals(1, updated);
        List<CheckpointRecord> all = adapter.listAll().join();
        assertEquals(2, all.size());
        for (CheckpointRecord record : all) {
            assertEquals("cp-2".equals(record.getCheckpointId()), record.isCompletedNaturally());
        }
        assertEquals(0, adapter.markRunCompleted("thread-1", "run-2").join());
    }

    @Test
    void shouldDeleteWritesOnChannelOnly() {
        CheckpointRecord record = checkpoint("thread-1", "cp-1", T0, "run-1");
        record.setWrites(new ArrayList<>(List.of(
                CheckpointWrite.builder().taskId("t1").channel(CheckpointRecord.ERROR_CHANNEL).value("boom").build(),
                CheckpointWrite.builder().taskId("t2").channel("messages").value("hi").build())));
        adapter.save(record).join();

        int removed = adapter.deleteWrites("thread-1", "cp-1", CheckpointRecord.ERROR_CHANNEL).join();

        assertEquals(1, removed);
        CheckpointRecord reloaded = adapter.findLatest("thread-1").join().orElseThrow();
        assertFalse(reloaded.hasWritesOn(CheckpointRecord.ERROR_CHANNEL));
        assertTrue(reloaded.hasWritesOn("messages"));
        assertEquals(0, adapter.deleteWrites("thread-1", "missing", CheckpointRecord.ERROR_CHANNEL).join());
    }

    @Test
    void shouldDeleteCheckpointsOlderThanCutoff() {
        adapter.save(checkpoint("thread-1", "old", T0, "run-1")).join();
        adapter.save(checkpoint("thread-1", "new", T0.plusSeconds(3600), "run-2")).join();

        int deleted = adapter.deleteOlderThan(T0.plusSeconds(60)).join();

        assertEquals(1, deleted);
        assertEquals("new", adapter.findLatest("thread-1").join().orElseThrow().getCheckpointId());
    }

    @Test
    void shouldRejectThreadIdEscapingStorage() {
        assertThrows(CompletionException.class, () -> adapter.findLatest("../outside").join());
    }

    private CheckpointRecord checkpoint(String threadId, String checkpointId, Instant createdAt, String runId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CheckpointRecord.METADATA_RUN_ID, runId);
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("messages", List.of(Map.of("role", "human", "content", "hello")));
        return CheckpointRecord.builder()
                .threadId(threadId)
                .checkpointId(checkpointId)
                .createdAt(createdAt)
                .metadata(metadata)
                .state(state)
                .build();
    }
}
