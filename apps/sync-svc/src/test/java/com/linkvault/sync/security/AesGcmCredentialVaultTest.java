package com.linkvault.sync.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.linkvault.sync.TestFixtures;
import com.linkvault.sync.config.LinkvaultProperties;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AesGcmCredentialVaultTest {

    private final AesGcmCredentialVault vault = new AesGcmCredentialVault(TestFixtures.properties());

    @Test
    void decryptReturnsOriginalSecret() {
        for (String secret : new String[]{"access-sandbox-123", "ü-ñ-✓", "x".repeat(4096)}) {
            assertThat(vault.decrypt(vault.encrypt(secret))).isEqualTo(secret);
        }
    }

    @Test
    void ciphertextCarriesKeyIdAndNeverThePlaintext() {
        String ciphertext = vault.encrypt("access-sandbox-123");

        assertThat(ciphertext).startsWith("k1:");
        assertThat(ciphertext).doesNotContain("access-sandbox-123");
        assertThat(vault.encrypt("access-sandbox-123")).isNotEqualTo(ciphertext);
    }

    @Test
    void tamperedCiphertextFails() {
        String ciphertext = vault.encrypt("access-sandbox-123");
        byte[] raw = Base64.getDecoder().decode(ciphertext.substring(3));
        for (int i = 0; i < raw.length; i++) {
            byte[] corrupted = raw.clone();
            corrupted[i] ^= 0x01;
            String tampered = "k1:" + Base64.getEncoder().encodeToString(corrupted);
            assertThatThrownBy(() -> vault.decrypt(tampered)).isInstanceOf(CredentialException.class);
        }
    }

    @Test
    void malformedCiphertextFails() {
        assertThatThrownBy(() -> vault.decrypt("")).isInstanceOf(CredentialException.class);
        assertThatThrownBy(() -> vault.decrypt("no-key-id")).isInstanceOf(CredentialException.class);
        assertThatThrownBy(() -> vault.decrypt("k1:%%%")).isInstanceOf(CredentialException.class);
        assertThatThrownBy(() -> vault.decrypt("k1:AAAA")).isInstanceOf(CredentialException.class);
        assertThatThrownBy(() -> vault.decrypt("k9:" + vault.encrypt("s").substring(3))).isInstanceOf(CredentialException.class);
    }

    @Test
    void bodiesTooShortForIvAndTagFailAsCredentialErrors() {
        for (int length = 0; length < 28; length++) {
            String truncated = "k1:" + Base64.getEncoder().encodeToString(new byte[length]);
            assertThatThrownBy(() -> vault.decrypt(truncated))
                    .as("body of %d bytes", length)
                    .isInstanceOf(CredentialException.class);
        }
        String sealed = vault.encrypt("access-sandbox-123");
        byte[] raw = Base64.getDecoder().decode(sealed.substring(3));
        for (int cut = 1; cut < raw.length; cut++) {
            String shortened = "k1:" + Base64.getEncoder().encodeToString(Arrays.copyOf(raw, raw.length - cut));
            assertThatThrownBy(() -> vault.decrypt(shortened)).isInstanceOf(CredentialException.class);
        }
    }

    @Test
    void swappingKeyIdFailsAuthentication() {
        AesGcmCredentialVault twoKeys = vaultWith("k1", Map.of("k1", TestFixtures.KEY_1, "k2", TestFixtures.KEY_1));
        String ciphertext = twoKeys.encrypt("access-sandbox-123");

        assertThatThrownBy(() -> twoKeys.decrypt("k2" + ciphertext.substring(2))).isInstanceOf(CredentialException.class);
    }

    @Test
    void secretsSealedBeforeRotationStayReadable() {
        AesGcmCredentialVault beforeRotation = vaultWith("k1", Map.of("k1", TestFixtures.KEY_1));
        String oldCiphertext = beforeRotation.encrypt("old-secret");

        AesGcmCredentialVault afterRotation = vaultWith("k2", Map.of("k1", TestFixtures.KEY_1, "k2", TestFixtures.KEY_2));

        assertThat(afterRotation.activeKeyId()).isEqualTo("k2");
        assertThat(afterRotation.encrypt("new-secret")).startsWith("k2:");
        assertThat(afterRotation.decrypt(oldCiphertext)).isEqualTo("old-secret");
    }

    @Test
    void rejectsBlankPlaintext() {
        assertThatThrownBy(() -> vault.encrypt(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static AesGcmCredentialVault vaultWith(String activeKeyId, Map<String, String> keys) {
        LinkvaultProperties base = TestFixtures.properties();
        return new AesGcmCredentialVault(new LinkvaultProperties(
                base.plaid(),
                new LinkvaultProperties.Vault(activeKeyId, keys),
                new LinkvaultProperties.Accounts(Duration.ofHours(24)),
                base.sync(),
                base.security()
        ));
    }
}
