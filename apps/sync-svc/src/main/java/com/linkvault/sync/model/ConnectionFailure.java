package com.linkvault.sync.model;

import com.linkvault.sync.connection.ConnectionStatus;

public record ConnectionFailure(
        String connectionId,
        String institutionName,
        ConnectionStatus status,
        String reason
) {
}
