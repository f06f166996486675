package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.connection.ConnectionStatus;
import com.linkvault.sync.model.ConnectionFailure;

public record ConnectionFailureDto(
        @JsonProperty("connection_id") String connectionId,
        @JsonProperty("institution_name") String institutionName,
        @JsonProperty("status") ConnectionStatus status,
        @JsonProperty("reason") String reason
) {
    public static ConnectionFailureDto from(ConnectionFailure failure) {
        return new ConnectionFailureDto(failure.connectionId(), failure.institutionName(), failure.status(), failure.reason());
    }
}
