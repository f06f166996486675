package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

public record TransactionsResponseDto(
        @JsonProperty("transactions") List<TransactionDto> transactions,
        @JsonProperty("transaction_count") int transactionCount,
        @JsonProperty("date_range") DateRangeDto dateRange
) {
    public record DateRangeDto(
            @JsonProperty("start_date") LocalDate startDate,
            @JsonProperty("end_date") LocalDate endDate,
            @JsonProperty("days") int days
    ) {
    }
}
