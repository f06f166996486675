package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record RevokeResponseDto(
        @JsonProperty("message") String message,
        @JsonProperty("success_count") int successCount,
        @JsonProperty("failures") List<ConnectionFailureDto> failures
) {
}
