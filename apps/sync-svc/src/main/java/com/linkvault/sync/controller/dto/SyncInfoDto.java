package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.model.SyncInfo;
import com.linkvault.sync.model.SyncStatus;
import java.time.Instant;

public record SyncInfoDto(
        @JsonProperty("status") SyncStatus status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("error_message") String errorMessage
) {
    public static SyncInfoDto from(SyncInfo info) {
        if (info == null) {
            return null;
        }
        return new SyncInfoDto(info.status(), info.startedAt(), info.completedAt(), info.errorMessage());
    }
}
