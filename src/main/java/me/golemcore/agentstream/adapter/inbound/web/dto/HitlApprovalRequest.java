package me.golemcore.agentstream.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of the HITL approve and respond endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HitlApprovalRequest {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("thread_id")
    private String threadId;

    private String action;

    @JsonProperty("response_text")
    private String responseText;

    @JsonProperty("tool_edits")
    private Map<String, Object> toolEdits;
}
