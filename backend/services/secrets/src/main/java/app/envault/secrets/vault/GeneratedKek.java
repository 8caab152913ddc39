package app.envault.secrets.vault;

/**
 * A freshly generated organization KEK together with its master-key wrap.
 * Only {@code encryptedKek} may be persisted; closing wipes the raw key.
 */
public record GeneratedKek(
        KeyMaterial kek,
        String encryptedKek
) implements AutoCloseable {

    @Override
    public void close() {
        kek.close();
    }
}
