package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;

public record AccountsDataInfoDto(
        @JsonProperty("has_data") boolean hasData,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("age_hours") Double ageHours,
        @JsonProperty("is_expired") boolean expired,
        @JsonProperty("is_stale") boolean stale,
        @JsonProperty("account_count") int accountCount,
        @JsonProperty("total_balance") BigDecimal totalBalance
) {
}
