package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LinkTokenResponseDto(
        @JsonProperty("link_token") String linkToken,
        @JsonProperty("expiration") String expiration
) {
}
