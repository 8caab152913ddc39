package app.envault.secrets.vault;

/**
 * Everything persisted for one secret value. Binary fields are Base64 encoded;
 * {@code encryptedDek} uses the {@code iv:authTag:ciphertext} wrap format.
 *
 * @param keyVersion version of the organization KEK that wraps {@code encryptedDek}
 */
public record EncryptedSecret(
        String ciphertext,
        String iv,
        String authTag,
        String encryptedDek,
        String algorithm,
        int keyVersion
) {
}
