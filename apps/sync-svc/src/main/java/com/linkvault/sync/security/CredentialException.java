package com.linkvault.sync.security;

/**
 * Raised when a secret cannot be sealed or opened. Messages never include secret material.
 */
public class CredentialException extends RuntimeException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
