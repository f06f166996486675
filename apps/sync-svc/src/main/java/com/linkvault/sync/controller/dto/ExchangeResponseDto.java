package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.connection.ConnectionStatus;

public record ExchangeResponseDto(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("institution_id") String institutionId,
        @JsonProperty("institution_name") String institutionName,
        @JsonProperty("status") ConnectionStatus status,
        @JsonProperty("trace_id") String traceId
) {
}
