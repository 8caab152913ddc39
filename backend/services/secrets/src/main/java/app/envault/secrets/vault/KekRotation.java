package app.envault.secrets.vault;

import java.util.List;

/**
 * Result of re-wrapping an organization's DEKs under a new KEK. Nothing here is persisted until
 * the caller commits it as a whole; dropping the instance aborts the rotation.
 */
public record KekRotation(
        String newEncryptedKek,
        List<WrappedDek> updatedDeks,
        int newVersion
) {

    public KekRotation {
        updatedDeks = List.copyOf(updatedDeks);
    }
}
