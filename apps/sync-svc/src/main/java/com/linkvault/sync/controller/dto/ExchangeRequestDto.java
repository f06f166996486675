package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * @param accountMasks masks of the accounts picked in the link widget; optional
 */
public record ExchangeRequestDto(
        @JsonProperty("public_token") @NotBlank String publicToken,
        @JsonProperty("account_masks") List<String> accountMasks
) {
}
