package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ForceRefreshResponseDto(
        @JsonProperty("success") boolean success,
        @JsonProperty("status") String status,
        @JsonProperty("async_operation") boolean asyncOperation,
        @JsonProperty("item_id") String itemId,
        @JsonProperty("institution_name") String institutionName,
        @JsonProperty("message") String message,
        @JsonProperty("transaction_sync") SyncInfoDto transactionSync
) {
}
