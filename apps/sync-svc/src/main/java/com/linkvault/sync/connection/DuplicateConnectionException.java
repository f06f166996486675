package com.linkvault.sync.connection;

public class DuplicateConnectionException extends RuntimeException {

    private final String existingConnectionId;

    public DuplicateConnectionException(String existingConnectionId, String institutionName) {
        super("Institution " + institutionName + " is already linked");
        this.existingConnectionId = existingConnectionId;
    }

    public String existingConnectionId() {
        return existingConnectionId;
    }
}
