package app.envault.secrets.vault;

import java.util.Base64;

/**
 * Output of one AES-GCM encryption. The tag is kept apart from the ciphertext because
 * secret versions persist the three fields in separate columns.
 */
public record SealedBox(
        byte[] iv,
        byte[] ciphertext,
        byte[] authTag
) {

    private static final String SEPARATOR = ":";

    /**
     * {@code iv:authTag:ciphertext}, each field Base64 encoded. Used for wrapped KEKs and DEKs.
     */
    public String toWireFormat() {
        Base64.Encoder encoder = Base64.getEncoder();
        return encoder.encodeToString(iv)
                + SEPARATOR + encoder.encodeToString(authTag)
                + SEPARATOR + encoder.encodeToString(ciphertext);
    }

    public static SealedBox fromWireFormat(String wrapped) {
        if (wrapped == null || wrapped.isBlank()) {
            throw new IllegalArgumentException("Wrapped key is empty");
        }
        String[] parts = wrapped.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Wrapped key must have the form iv:authTag:ciphertext");
        }
        Base64.Decoder decoder = Base64.getDecoder();
        byte[] iv = decoder.decode(parts[0]);
        byte[] authTag = decoder.decode(parts[1]);
        byte[] ciphertext = decoder.decode(parts[2]);
        if (iv.length != EnvelopeCrypto.IV_LENGTH || authTag.length != EnvelopeCrypto.TAG_LENGTH) {
            throw new IllegalArgumentException("Wrapped key has an invalid iv or tag length");
        }
        return new SealedBox(iv, ciphertext, authTag);
    }
}
