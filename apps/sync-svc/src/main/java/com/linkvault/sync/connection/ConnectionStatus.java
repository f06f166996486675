package com.linkvault.sync.connection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConnectionStatus {
    ACTIVE("active"),
    LOGIN_REQUIRED("login_required"),
    REVOKED("revoked"),
    ERROR("error");

    private final String wireValue;

    ConnectionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ConnectionStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConnectionStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown connection status: " + value);
    }
}
