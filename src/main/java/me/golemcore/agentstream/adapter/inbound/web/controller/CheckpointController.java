package me.golemcore.agentstream.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.adapter.inbound.web.dto.CheckpointCleanupResponse;
import me.golemcore.agentstream.domain.service.CheckpointMaintenanceService;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * On-demand checkpoint maintenance.
 */
@RestController
@RequestMapping("/api/v1/admin/checkpoints")
@RequiredArgsConstructor
@Slf4j
public class CheckpointController {

    private final CheckpointMaintenanceService maintenanceService;
    private final AgentStreamProperties properties;

    @PostMapping("/cleanup")
    public Mono<ResponseEntity<CheckpointCleanupResponse>> cleanup() {
        log.info("[API] Checkpoint cleanup requested");
        return Mono.fromFuture(maintenanceService::runMaintenance)
                .map(result -> ResponseEntity.ok(CheckpointCleanupResponse.builder()
                        .falseErrorWritesDeleted(result.falseErrorWritesDeleted())
                        .expiredCheckpointsDeleted(result.expiredCheckpointsDeleted())
                        .retentionDays(properties.getCheckpoint().getRetentionDays())
                        .build()));
    }
}
