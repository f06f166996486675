package com.linkvault.sync.connection;

public class ConnectionNotFoundException extends RuntimeException {

    public ConnectionNotFoundException(String connectionId) {
        super("Bank connection not found: " + connectionId);
    }
}
