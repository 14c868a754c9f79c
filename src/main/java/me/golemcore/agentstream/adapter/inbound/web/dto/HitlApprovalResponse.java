package me.golemcore.agentstream.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HitlApprovalResponse {

    private boolean success;
    private String message;

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("updated_status")
    private String updatedStatus;
}
