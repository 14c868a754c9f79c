package me.golemcore.agentstream.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.domain.model.CheckpointCleanupResult;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic checkpoint maintenance: removes false error writes left by
 * completion races and deletes expired checkpoints.
 */
@Service
@Slf4j
public class CheckpointMaintenanceService {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final CheckpointRaceGuard raceGuard;
    private final AgentStreamProperties.CheckpointProperties settings;

    private final ScheduledExecutorService maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "checkpoint-maintenance");
        t.setDaemon(true);
        return t;
    });

    public CheckpointMaintenanceService(CheckpointRaceGuard raceGuard, AgentStreamProperties properties) {
        this.raceGuard = raceGuard;
        this.settings = properties.getCheckpoint();
    }

    @PostConstruct
    void init() {
        if (!settings.isCleanupEnabled()) {
            log.info("[Checkpoint] Scheduled maintenance disabled");
            return;
        }
        Duration interval = settings.getCleanupInterval();
        maintenanceExecutor.scheduleWithFixedDelay(this::runScheduled,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[Checkpoint] Scheduled maintenance every {}", interval);
    }

    @PreDestroy
    void destroy() {
        maintenanceExecutor.shutdownNow();
        try {
            maintenanceExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs both cleanups, false errors first.
     */
    public CompletableFuture<CheckpointCleanupResult> runMaintenance() {
        return raceGuard.cleanupFalseErrors()
                .thenCompose(falseErrors -> raceGuard.cleanupOldCheckpoints(settings.getRetentionDays())
                        .thenApply(expired -> new CheckpointCleanupResult(falseErrors, expired)));
    }

    private void runScheduled() {
        try {
            CheckpointCleanupResult result = runMaintenance().join();
            log.debug("[Checkpoint] Maintenance finished: {}", result);
        } catch (RuntimeException e) { // NOSONAR - keep the schedule alive
            log.warn("[Checkpoint] Maintenance failed: {}", e.getMessage());
        }
    }
}
