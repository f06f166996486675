package com.linkvault.sync.storage;

/**
 * Key layout of the owner partition. One family per persisted entity.
 */
public final class DocumentKeys {

    public static final String CONNECTION = "connection";
    public static final String ACCOUNTS = "accounts";
    public static final String TRANSACTION = "transaction";
    public static final String CURSOR = "cursor";

    public static final String ACCOUNTS_CACHE = ACCOUNTS + ":cache";

    private DocumentKeys() {
    }

    public static String connection(String connectionId) {
        return CONNECTION + ":" + connectionId;
    }

    public static String transaction(String transactionId) {
        return TRANSACTION + ":" + transactionId;
    }

    public static String cursor(String connectionId) {
        return CURSOR + ":" + connectionId;
    }

    public static String familyOf(String key) {
        int separator = key.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("document key has no family: " + key);
        }
        return key.substring(0, separator);
    }
}
