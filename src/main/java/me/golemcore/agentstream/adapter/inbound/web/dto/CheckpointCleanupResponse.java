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
public class CheckpointCleanupResponse {

    @JsonProperty("false_error_writes_deleted")
    private int falseErrorWritesDeleted;

    @JsonProperty("expired_checkpoints_deleted")
    private int expiredCheckpointsDeleted;

    @JsonProperty("retention_days")
    private int retentionDays;
}
