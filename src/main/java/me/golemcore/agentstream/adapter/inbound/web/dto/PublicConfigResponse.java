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
public class PublicConfigResponse {

    private String env;

    @JsonProperty("api_version")
    private String apiVersion;

    @JsonProperty("websocket_path")
    private String websocketPath;

    @JsonProperty("stream_timeout_seconds")
    private long streamTimeoutSeconds;

    @JsonProperty("heartbeat_interval_seconds")
    private long heartbeatIntervalSeconds;

    @JsonProperty("hitl_enabled")
    private boolean hitlEnabled;

    @JsonProperty("default_agent")
    private String defaultAgent;
}
