package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.connection.ConnectionStatus;
import java.time.Instant;
import java.util.List;

public record BanksResponseDto(
        @JsonProperty("banks") List<BankDto> banks,
        @JsonProperty("banks_count") int banksCount
) {
    public record BankDto(@JsonProperty("item") ItemDto item) {
    }

    public record ItemDto(
            @JsonProperty("item_id") String itemId,
            @JsonProperty("institution_id") String institutionId,
            @JsonProperty("institution_name") String institutionName,
            @JsonProperty("status") ConnectionStatus status,
            @JsonProperty("status_reason") String statusReason,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("last_used_at") Instant lastUsedAt,
            @JsonProperty("account_sync") SyncInfoDto accountSync,
            @JsonProperty("transaction_sync") SyncInfoDto transactionSync,
            @JsonProperty("accounts") List<AccountDto> accounts
    ) {
    }
}
