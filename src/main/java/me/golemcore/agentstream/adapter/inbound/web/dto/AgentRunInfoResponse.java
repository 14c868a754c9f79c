package me.golemcore.agentstream.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunInfoResponse {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("thread_id")
    private String threadId;

    private String status;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    private String error;
    private Map<String, Object> metadata;
}
