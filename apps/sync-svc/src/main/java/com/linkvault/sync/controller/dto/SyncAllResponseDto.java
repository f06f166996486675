package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record SyncAllResponseDto(
        @JsonProperty("results") List<RefreshTransactionsResponseDto> results,
        @JsonProperty("success_count") int successCount,
        @JsonProperty("failures") List<ConnectionFailureDto> failures
) {
}
