package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.connection.ConnectionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record AccountsResponseDto(
        @JsonProperty("institutions") List<InstitutionDto> institutions,
        @JsonProperty("accounts_count") int accountsCount,
        @JsonProperty("banks_count") int banksCount,
        @JsonProperty("total_balance") BigDecimal totalBalance,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("from_stored") boolean fromStored,
        @JsonProperty("is_stale") boolean stale,
        @JsonProperty("partial_failure") boolean partialFailure,
        @JsonProperty("failures") List<ConnectionFailureDto> failures,
        @JsonProperty("trace_id") String traceId
) {
    public record InstitutionDto(
            @JsonProperty("item_id") String itemId,
            @JsonProperty("institution_id") String institutionId,
            @JsonProperty("name") String name,
            @JsonProperty("status") ConnectionStatus status,
            @JsonProperty("error_message") String errorMessage,
            @JsonProperty("total_balance") BigDecimal totalBalance,
            @JsonProperty("account_count") int accountCount,
            @JsonProperty("accounts") List<AccountDto> accounts
    ) {
    }
}
