package app.envault.secrets.vault;

import java.util.UUID;

/**
 * The wrapped DEK of one secret version, as fed into and returned from KEK rotation.
 */
public record WrappedDek(
        UUID versionId,
        String encryptedDek
) {
}
