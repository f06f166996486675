package com.linkvault.sync.service;

public enum SyncKind {
    ACCOUNTS,
    TRANSACTIONS
}
