package me.golemcore.agentstream.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of the HTTP chat endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private String message;

    @JsonProperty("thread_id")
    private String threadId;

    private String agent;

    private Map<String, Object> metadata;
}
