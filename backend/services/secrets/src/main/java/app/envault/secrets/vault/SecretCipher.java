package app.envault.secrets.vault;

import app.envault.secrets.exception.AuthenticationFailedException;
import app.envault.secrets.exception.DecryptionFailedException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Encrypts secret values under a one-time DEK and wraps that DEK with the organization KEK.
 */
@Component
public class SecretCipher {

    private final EnvelopeCrypto crypto;
    private final SecureRandom random = new SecureRandom();

    public SecretCipher(EnvelopeCrypto crypto) {
        this.crypto = crypto;
    }

    public EncryptedSecret encryptSecret(String plaintext, KeyMaterial orgKek, int kekVersion) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        try (KeyMaterial dek = KeyMaterial.random(random, EnvelopeCrypto.KEY_LENGTH)) {
            String encryptedDek = crypto.wrap(orgKek.bytes(), dek.bytes());
            byte[] plaintextBytes = plaintext.getBytes(StandardCharsets.UTF_8);
            SealedBox box;
            try {
                box = crypto.encrypt(dek.bytes(), plaintextBytes);
            } finally {
                Arrays.fill(plaintextBytes, (byte) 0);
            }
            Base64.Encoder encoder = Base64.getEncoder();
            return new EncryptedSecret(
                    encoder.encodeToString(box.ciphertext()),
                    encoder.encodeToString(box.iv()),
                    encoder.encodeToString(box.authTag()),
                    encryptedDek,
                    EnvelopeCrypto.ALGORITHM,
                    kekVersion
            );
        }
    }

    /**
     * @throws DecryptionFailedException on any verification failure of the DEK wrap or of the value itself
     */
    public String decryptSecret(EncryptedSecret bundle, KeyMaterial orgKek) {
        if (!EnvelopeCrypto.ALGORITHM.equals(bundle.algorithm())) {
            throw new DecryptionFailedException("Unsupported secret algorithm: " + bundle.algorithm(), null);
        }
        try (KeyMaterial dek = crypto.unwrap(orgKek.bytes(), bundle.encryptedDek())) {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] plaintext = crypto.decrypt(
                    dek.bytes(),
                    decoder.decode(bundle.iv()),
                    decoder.decode(bundle.ciphertext()),
                    decoder.decode(bundle.authTag())
            );
            try {
                return new String(plaintext, StandardCharsets.UTF_8);
            } finally {
                Arrays.fill(plaintext, (byte) 0);
            }
        } catch (AuthenticationFailedException | IllegalArgumentException ex) {
            throw new DecryptionFailedException("Secret value failed verification", ex);
        }
    }
}
