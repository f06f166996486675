package com.linkvault.sync.service;

public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String message) {
        super(message);
    }
}
