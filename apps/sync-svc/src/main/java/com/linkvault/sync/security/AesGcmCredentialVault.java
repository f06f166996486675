package com.linkvault.sync.security;

import com.linkvault.sync.config.LinkvaultProperties;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * AES-GCM vault with a rotating key ring. Ciphertext layout is {@code keyId:base64(iv || sealed)}; the key id
 * is bound as additional authenticated data so it cannot be swapped without failing the tag check.
 */
@Component
public class AesGcmCredentialVault implements CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(AesGcmCredentialVault.class);
    private static final int GCM_TAG_LENGTH_BITS = 128;
    private static final int IV_LENGTH_BYTES = 12;
    private static final int MIN_SEALED_LENGTH_BYTES = IV_LENGTH_BYTES + GCM_TAG_LENGTH_BITS / 8;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final Map<String, SecretKey> keyRing;
    private final String activeKeyId;
    private final SecureRandom secureRandom = new SecureRandom();

    public AesGcmCredentialVault(LinkvaultProperties properties) {
        LinkvaultProperties.Vault vault = properties.vault();
        Map<String, SecretKey> ring = new HashMap<>();
        vault.keys().forEach((keyId, material) ->
                ring.put(keyId, new SecretKeySpec(Base64.getDecoder().decode(material.trim()), "AES")));
        this.keyRing = Map.copyOf(ring);
        this.activeKeyId = vault.activeKeyId();
        log.info("Credential vault initialised with {} key(s), active key id {}", keyRing.size(), activeKeyId);
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("Plaintext must not be blank");
        }
        try {
            byte[] iv = new byte[IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyRing.get(activeKeyId), new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            cipher.updateAAD(activeKeyId.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + sealed.length);
            buffer.put(iv);
            buffer.put(sealed);
            return activeKeyId + ":" + Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException ex) {
            throw new CredentialException("Failed to encrypt credential", ex);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new CredentialException("Ciphertext is empty");
        }
        int separator = ciphertext.indexOf(':');
        if (separator <= 0) {
            throw new CredentialException("Ciphertext has no key id");
        }
        String keyId = ciphertext.substring(0, separator);
        SecretKey key = keyRing.get(keyId);
        if (key == null) {
            throw new CredentialException("Unknown vault key id " + keyId);
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(ciphertext.substring(separator + 1));
        } catch (IllegalArgumentException ex) {
            throw new CredentialException("Ciphertext is not valid base64", ex);
        }
        if (decoded.length < MIN_SEALED_LENGTH_BYTES) {
            throw new CredentialException("Ciphertext is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, decoded, 0, IV_LENGTH_BYTES));
            cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
            byte[] plainBytes = cipher.doFinal(decoded, IV_LENGTH_BYTES, decoded.length - IV_LENGTH_BYTES);
            return new String(plainBytes, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | RuntimeException ex) {
            // providers report some malformed inputs as unchecked ProviderException
            throw new CredentialException("Failed to decrypt credential", ex);
        }
    }

    String activeKeyId() {
        return activeKeyId;
    }
}
