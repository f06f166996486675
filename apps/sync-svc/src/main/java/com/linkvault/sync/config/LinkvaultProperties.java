package com.linkvault.sync.config;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "linkvault")
public record LinkvaultProperties(
        Plaid plaid,
        Vault vault,
        Accounts accounts,
        Sync sync,
        Security security
) {

    @ConstructorBinding
    public LinkvaultProperties {
        if (plaid == null) {
            throw new IllegalArgumentException("plaid configuration must be provided");
        }
        if (vault == null) {
            throw new IllegalArgumentException("vault configuration must be provided");
        }
        // accounts, sync and security fall back to defaults via accessor methods
    }

    public Accounts accounts() {
        return accounts != null ? accounts : new Accounts(null);
    }

    public Sync sync() {
        return sync != null ? sync : new Sync(null, null, null);
    }

    public Security security() {
        return security != null ? security : new Security(null);
    }

    public record Plaid(
            String clientId,
            String clientSecret,
            String environment,
            String baseUrl,
            String clientName,
            List<String> countryCodes,
            List<String> products,
            Integer maxRetries,
            Duration initialBackoff,
            Duration requestTimeout
    ) {
        private static final Set<String> ENVIRONMENTS = Set.of("sandbox", "development", "production");

        public Plaid {
            if (clientId == null || clientId.isBlank()) {
                throw new IllegalArgumentException("clientId must be provided");
            }
            if (clientSecret == null || clientSecret.isBlank()) {
                throw new IllegalArgumentException("clientSecret must be provided");
            }
            environment = (environment == null || environment.isBlank()) ? "sandbox" : environment.trim().toLowerCase();
            if (!ENVIRONMENTS.contains(environment)) {
                throw new IllegalArgumentException("environment must be one of " + ENVIRONMENTS);
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://" + environment + ".plaid.com";
            }
            if (clientName == null || clientName.isBlank()) {
                clientName = "LinkVault";
            }
            countryCodes = (countryCodes == null || countryCodes.isEmpty()) ? List.of("US") : List.copyOf(countryCodes);
            products = (products == null || products.isEmpty()) ? List.of("transactions") : List.copyOf(products);
            if (maxRetries == null) {
                maxRetries = 3;
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(200);
            }
            if (requestTimeout == null) {
                requestTimeout = Duration.ofSeconds(30);
            }
        }
    }

    /**
     * Symmetric key ring for the credential vault. Keys are base64 encoded AES keys indexed by key id;
     * new secrets are sealed with {@code activeKeyId}, older key ids stay around for decryption.
     */
    public record Vault(String activeKeyId, Map<String, String> keys) {
        public Vault {
            if (keys == null || keys.isEmpty()) {
                throw new IllegalArgumentException("at least one vault key must be provided");
            }
            if (activeKeyId == null || activeKeyId.isBlank()) {
                throw new IllegalArgumentException("activeKeyId must be provided");
            }
            if (!keys.containsKey(activeKeyId)) {
                throw new IllegalArgumentException("activeKeyId " + activeKeyId + " has no key material");
            }
            for (Map.Entry<String, String> entry : keys.entrySet()) {
                if (entry.getKey().contains(":")) {
                    throw new IllegalArgumentException("key id must not contain ':' (" + entry.getKey() + ")");
                }
                int length;
                try {
                    length = Base64.getDecoder().decode(entry.getValue().trim()).length;
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("key " + entry.getKey() + " is not valid base64", ex);
                }
                if (length != 16 && length != 24 && length != 32) {
                    throw new IllegalArgumentException("key " + entry.getKey() + " must be 128, 192 or 256 bits");
                }
            }
            keys = Map.copyOf(keys);
        }
    }

    public record Accounts(Duration cacheTtl) {
        public Accounts {
            if (cacheTtl == null) {
                cacheTtl = Duration.ofHours(24);
            }
            if (cacheTtl.isNegative() || cacheTtl.isZero()) {
                throw new IllegalArgumentException("cacheTtl must be positive");
            }
        }
    }

    public record Sync(Integer maxConcurrency, Integer maxIterations, Duration revokeWaitTimeout) {
        public Sync {
            if (maxConcurrency == null) {
                maxConcurrency = 4;
            }
            if (maxIterations == null) {
                maxIterations = 50;
            }
            if (revokeWaitTimeout == null) {
                revokeWaitTimeout = Duration.ofSeconds(10);
            }
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive");
            }
            if (maxIterations <= 0) {
                throw new IllegalArgumentException("maxIterations must be positive");
            }
            if (revokeWaitTimeout.isNegative()) {
                throw new IllegalArgumentException("revokeWaitTimeout must not be negative");
            }
        }
    }

    public record Security(String devJwtSecret) {
        public boolean hasDevJwtSecret() {
            return devJwtSecret != null && !devJwtSecret.isBlank();
        }
    }
}
