package app.envault.secrets.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param masterKey Base64 of exactly 32 bytes
 * @param keyId     label logged at startup in place of the key itself
 */
@ConfigurationProperties(prefix = "app.secrets.vault")
public record VaultProps(
        String masterKey,
        String keyId
) {
}
