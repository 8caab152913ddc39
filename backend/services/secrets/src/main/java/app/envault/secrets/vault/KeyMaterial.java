package app.envault.secrets.vault;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Raw KEK or DEK bytes owned by exactly one call stack. Closing zeroes the bytes, so
 * try-with-resources wipes the key on every exit path, exceptions included.
 */
public final class KeyMaterial implements AutoCloseable {

    private final byte[] bytes;
    private volatile boolean wiped;

    private KeyMaterial(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Takes ownership of {@code bytes}; the caller must not keep another reference.
     */
    public static KeyMaterial adopt(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("key bytes are required");
        }
        return new KeyMaterial(bytes);
    }

    public static KeyMaterial random(SecureRandom random, int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return new KeyMaterial(bytes);
    }

    public byte[] bytes() {
        if (wiped) {
            throw new IllegalStateException("key material has been wiped");
        }
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isWiped() {
        return wiped;
    }

    @Override
    public void close() {
        Arrays.fill(bytes, (byte) 0);
        wiped = true;
    }

    @Override
    public String toString() {
        return "KeyMaterial[" + bytes.length + " bytes" + (wiped ? ", wiped" : "") + "]";
    }
}
