package me.golemcore.agentstream.adapter.outbound.storage;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.CheckpointRecord;
import me.golemcore.agentstream.domain.model.CheckpointWrite;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.CheckpointPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link CheckpointPort}.
 *
 * <p>
 * Each checkpoint is one JSON file at
 * {@code checkpoints/<threadId>/<checkpointId>.json} under the configured base
 * path ({@code agent-stream.storage.base-path}). Writes go to a temporary file
 * first and are moved into place. Read-modify-write operations are serialized
 * within the process.
 *
 * @see me.golemcore.agentstream.port.outbound.CheckpointPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalCheckpointAdapter implements CheckpointPort {

    static final String CHECKPOINTS_DIR = "checkpoints";
    private static final String FILE_SUFFIX = ".json";

    private final AgentStreamProperties properties;
    private final ObjectMapper objectMapper;

    private final Object writeLock = new Object();
    private Path basePath;
    private Path checkpointsPath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.checkpointsPath = basePath.resolve(CHECKPOINTS_DIR);
        try {
            Files.createDirectories(checkpointsPath);
            log.info("[Checkpoint] Local checkpoint storage initialized at: {}", checkpointsPath);
        } catch (IOException e) {
            log.error("[Checkpoint] Failed to create checkpoint directory", e);
        }
    }

    @Override
    public CompletableFuture<Void> save(CheckpointRecord checkpoint) {
        return CompletableFuture.runAsync(() -> {
            synchronized (writeLock) {
                write(checkpoint);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<CheckpointRecord>> findLatest(String threadId) {
        return CompletableFuture.supplyAsync(() -> readThread(threadId).stream()
                .max(Comparator.comparing(CheckpointRecord::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder()))));
    }

    @Override
    public CompletableFuture<List<CheckpointRecord>> listAll() {
        return CompletableFuture.supplyAsync(this::readAll);
    }

    @Override
    public CompletableFuture<Integer> markRunCompleted(String threadId, String runId) {
        return CompletableFuture.supplyAsync(() -> {
            synchronized (writeLock) {
                int updated = 0;
                for (CheckpointRecord checkpoint : readThread(threadId)) {
                    if (runId != null && runId.equals(checkpoint.getRunId()) && !checkpoint.isCompletedNaturally()) {
                        checkpoint.getMetadata().put(CheckpointRecord.METADATA_COMPLETED_NATURALLY, true);
                        write(checkpoint);
                        updated++;
                    }
                }
                return updated;
            }
        });
    }

    @Override
    public CompletableFuture<Integer> deleteWrites(String threadId, String checkpointId, String channel) {
        return CompletableFuture.supplyAsync(() -> {
            synchronized (writeLock) {
                Path file = resolveCheckpoint(threadId, checkpointId);
                if (!Files.exists(file)) {
                    return 0;
                }
                CheckpointRecord checkpoint = read(file);
                List<CheckpointWrite> kept = new ArrayList<>();
                for (CheckpointWrite pending : checkpoint.getWrites()) {
                    if (!channel.equals(pending.getChannel())) {
                        kept.add(pending);
                    }
                }
                int removed = checkpoint.getWrites().size() - kept.size();
                if (removed > 0) {
                    checkpoint.setWrites(kept);
                    write(checkpoint);
                    log.debug("[Checkpoint] Removed {} writes on {}: threadId={}, checkpointId={}",
                            removed, channel, threadId, checkpointId);
                }
                return removed;
            }
        });
    }

    @Override
    public CompletableFuture<Integer> deleteOlderThan(Instant cutoff) {
        return CompletableFuture.supplyAsync(() -> {
            synchronized (writeLock) {
                int deleted = 0;
                for (Path file : listCheckpointFiles()) {
                    CheckpointRecord checkpoint = read(file);
                    if (checkpoint.getCreatedAt() != null && checkpoint.getCreatedAt().isBefore(cutoff)) {
                        deleteFile(file);
                        deleted++;
                    }
                }
                return deleted;
            }
        });
    }

    private List<CheckpointRecord> readAll() {
        List<CheckpointRecord> result = new ArrayList<>();
        for (Path file : listCheckpointFiles()) {
            result.add(read(file));
        }
        return result;
    }

    private List<CheckpointRecord> readThread(String threadId) {
        Path threadDir = resolveThread(threadId);
        if (!Files.isDirectory(threadDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(threadDir)) {
            return files.filter(this::isCheckpointFile).map(this::read).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints: " + threadId, e);
        }
    }

    private List<Path> listCheckpointFiles() {
        if (!Files.isDirectory(checkpointsPath)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(checkpointsPath, 2)) {
            return paths.filter(this::isCheckpointFile).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints", e);
        }
    }

    private boolean isCheckpointFile(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(FILE_SUFFIX);
    }

    private CheckpointRecord read(Path file) {
        try {
            return objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), CheckpointRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint: " + file.getFileName(), e);
        }
    }

    private void write(CheckpointRecord checkpoint) {
        Path target = resolveCheckpoint(checkpoint.getThreadId(), checkpoint.getCheckpointId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(temp, objectMapper.writeValueAsString(checkpoint), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint: " + checkpoint.getThreadId() + "/"
                    + checkpoint.getCheckpointId(), e);
        }
    }

    private void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoint: " + file.getFileName(), e);
        }
    }

    private Path resolveThread(String threadId) {
        Path resolved = checkpointsPath.resolve(threadId).normalize();
        if (!resolved.startsWith(checkpointsPath) || resolved.equals(checkpointsPath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + threadId);
        }
        return resolved;
    }

    private Path resolveCheckpoint(String threadId, String checkpointId) {
        Path threadDir = resolveThread(threadId);
        Path resolved = threadDir.resolve(checkpointId + FILE_SUFFIX).normalize();
        if (!resolved.startsWith(threadDir)) {
            throw new IllegalArgumentException("Path traversal blocked: " + threadId + "/" + checkpointId);
        }
        return resolved;
    }
}
