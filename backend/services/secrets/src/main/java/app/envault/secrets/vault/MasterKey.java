package app.envault.secrets.vault;

import app.envault.secrets.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Base64;

/**
 * Root of the key hierarchy. Immutable process-wide configuration: it is built once at startup,
 * never persisted and never rotated at runtime.
 */
public final class MasterKey {

    public static final int LENGTH = 32;

    private final byte[] key;
    private final String keyId;

    private MasterKey(byte[] key, String keyId) {
        this.key = key;
        this.keyId = keyId;
    }

    public static MasterKey fromBase64(String encoded, String keyId) {
        if (encoded == null || encoded.isBlank()) {
            throw new ConfigurationException("app.secrets.vault.master-key is required");
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("app.secrets.vault.master-key must be Base64 encoded", ex);
        }
        if (decoded.length != LENGTH) {
            Arrays.fill(decoded, (byte) 0);
            throw new ConfigurationException("app.secrets.vault.master-key must decode to exactly 32 bytes");
        }
        String id = keyId == null || keyId.isBlank() ? "local-master" : keyId.trim();
        return new MasterKey(decoded, id);
    }

    public static MasterKey of(byte[] key, String keyId) {
        if (key == null || key.length != LENGTH) {
            throw new ConfigurationException("master key must be exactly 32 bytes");
        }
        return new MasterKey(key.clone(), keyId == null ? "local-master" : keyId);
    }

    public String keyId() {
        return keyId;
    }

    // Shared with the key hierarchy only; callers must not modify or retain the array.
    byte[] keyBytes() {
        return key;
    }

    @Override
    public String toString() {
        return "MasterKey[keyId=" + keyId + "]";
    }
}
