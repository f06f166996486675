package com.linkvault.sync.security;

/**
 * Seals and opens per-institution access secrets. Implementations must be authenticated: a tampered
 * or foreign ciphertext fails with {@link CredentialException} instead of yielding plaintext.
 */
public interface CredentialVault {
    String encrypt(String plaintext);
    String decrypt(String ciphertext);
}
