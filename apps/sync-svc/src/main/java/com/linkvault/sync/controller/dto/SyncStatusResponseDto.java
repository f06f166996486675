package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.connection.ConnectionStatus;

public record SyncStatusResponseDto(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("institution_name") String institutionName,
        @JsonProperty("connection_status") ConnectionStatus connectionStatus,
        @JsonProperty("running") boolean running,
        @JsonProperty("account_sync") SyncInfoDto accountSync,
        @JsonProperty("transaction_sync") SyncInfoDto transactionSync
) {
}
