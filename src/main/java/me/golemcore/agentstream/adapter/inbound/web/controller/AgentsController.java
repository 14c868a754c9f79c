package me.golemcore.agentstream.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.adapter.inbound.web.dto.AgentRunInfoResponse;
import me.golemcore.agentstream.adapter.inbound.web.dto.HitlApprovalRequest;
import me.golemcore.agentstream.adapter.inbound.web.dto.HitlApprovalResponse;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.model.AgentRunInfo;
import me.golemcore.agentstream.domain.model.AgentRunStatus;
import me.golemcore.agentstream.domain.model.HitlAction;
import me.golemcore.agentstream.domain.model.HitlDecision;
import me.golemcore.agentstream.domain.service.AgentRunService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Run status and human-in-the-loop endpoints of a thread.
 */
@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
@Slf4j
public class AgentsController {

    private final AgentRunService agentRunService;

    @GetMapping("/{threadId}")
    public Mono<ResponseEntity<AgentRunInfoResponse>> getStatus(@PathVariable String threadId) {
        return Mono.fromFuture(() -> agentRunService.getStatus(threadId))
                .map(info -> ResponseEntity.ok(toResponse(info)));
    }

    @PostMapping("/{threadId}/approve")
    public Mono<ResponseEntity<HitlApprovalResponse>> approve(@PathVariable String threadId,
            @RequestBody HitlApprovalRequest body) {
        if (body == null) {
            throw new RunValidationException("Invalid request format");
        }
        HitlAction action = HitlAction.fromValue(body.getAction())
                .orElseThrow(() -> new RunValidationException("Invalid request format"));
        return decide(threadId, body, action);
    }

    @PostMapping("/{threadId}/respond")
    public Mono<ResponseEntity<HitlApprovalResponse>> respond(@PathVariable String threadId,
            @RequestBody HitlApprovalRequest body) {
        if (body == null) {
            throw new RunValidationException("Invalid request format");
        }
        if (body.getResponseText() == null || body.getResponseText().isBlank()) {
            throw new RunValidationException("response_text cannot be empty");
        }
        return decide(threadId, body, HitlAction.RESPOND);
    }

    private Mono<ResponseEntity<HitlApprovalResponse>> decide(String threadId, HitlApprovalRequest body,
            HitlAction action) {
        log.info("[API] HITL {} requested: threadId={}, runId={}", action.getValue(), threadId, body.getRunId());
        HitlDecision decision = HitlDecision.builder()
                .runId(body.getRunId())
                .threadId(body.getThreadId())
                .action(action)
                .responseText(body.getResponseText())
                .toolEdits(body.getToolEdits())
                .build();
        return Mono.fromFuture(() -> agentRunService.applyDecision(threadId, decision))
                .map(checkpoint -> ResponseEntity.ok(HitlApprovalResponse.builder()
                        .success(true)
                        .message(capitalize(action.getValue()) + " action processed successfully")
                        .runId(decision.getRunId())
                        .threadId(checkpoint.getThreadId())
                        .updatedStatus(AgentRunStatus.RUNNING.getValue())
                        .build()));
    }

    private AgentRunInfoResponse toResponse(AgentRunInfo info) {
        return AgentRunInfoResponse.builder()
                .runId(info.getRunId())
                .threadId(info.getThreadId())
                .status(info.getStatus().getValue())
                .startedAt(info.getStartedAt())
                .completedAt(info.getCompletedAt())
                .error(info.getError())
                .metadata(info.getMetadata())
                .build();
    }

    private String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
