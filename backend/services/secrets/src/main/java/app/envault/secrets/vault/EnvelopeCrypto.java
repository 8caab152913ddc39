package app.envault.secrets.vault;

import app.envault.secrets.exception.AuthenticationFailedException;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * The single authenticated-encryption primitive behind every wrap and every value encryption:
 * AES-256-GCM with a fresh random 16-byte IV per call and a 16-byte tag.
 */
@Component
public class EnvelopeCrypto {

    public static final String ALGORITHM = "aes-256-gcm";
    public static final int KEY_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int TAG_LENGTH_BITS = TAG_LENGTH * 8;

    private final SecureRandom random;

    public EnvelopeCrypto() {
        this(new SecureRandom());
    }

    EnvelopeCrypto(SecureRandom random) {
        this.random = random;
    }

    public SealedBox encrypt(byte[] key, byte[] plaintext) {
        requireKey(key);
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to encrypt with " + ALGORITHM, ex);
        }
        // JCE appends the tag to the ciphertext.
        int ciphertextLength = sealed.length - TAG_LENGTH;
        byte[] ciphertext = Arrays.copyOfRange(sealed, 0, ciphertextLength);
        byte[] authTag = Arrays.copyOfRange(sealed, ciphertextLength, sealed.length);
        return new SealedBox(iv, ciphertext, authTag);
    }

    public byte[] decrypt(byte[] key, SealedBox box) {
        return decrypt(key, box.iv(), box.ciphertext(), box.authTag());
    }

    /**
     * @throws AuthenticationFailedException when the tag does not verify; no plaintext is released
     */
    public byte[] decrypt(byte[] key, byte[] iv, byte[] ciphertext, byte[] authTag) {
        requireKey(key);
        if (iv == null || iv.length != IV_LENGTH) {
            throw new IllegalArgumentException("iv must be " + IV_LENGTH + " bytes");
        }
        if (authTag == null || authTag.length != TAG_LENGTH) {
            throw new IllegalArgumentException("authTag must be " + TAG_LENGTH + " bytes");
        }
        if (ciphertext == null) {
            throw new IllegalArgumentException("ciphertext is required");
        }
        byte[] sealed = new byte[ciphertext.length + TAG_LENGTH];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(authTag, 0, sealed, ciphertext.length, TAG_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException ex) {
            throw new AuthenticationFailedException("Authentication tag verification failed", ex);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to decrypt with " + ALGORITHM, ex);
        }
    }

    /**
     * Wraps a raw key under {@code wrappingKey} and renders it in the {@code iv:authTag:ciphertext} format.
     */
    public String wrap(byte[] wrappingKey, byte[] keyToWrap) {
        return encrypt(wrappingKey, keyToWrap).toWireFormat();
    }

    /**
     * Inverse of {@link #wrap}. The returned key is owned by the caller and must be closed.
     *
     * @throws AuthenticationFailedException when the wrap was produced under another key or was altered
     * @throws IllegalArgumentException      when the wrap is not in the expected format
     */
    public KeyMaterial unwrap(byte[] wrappingKey, String wrapped) {
        SealedBox box = SealedBox.fromWireFormat(wrapped);
        KeyMaterial key = KeyMaterial.adopt(decrypt(wrappingKey, box));
        if (key.length() != KEY_LENGTH) {
            key.close();
            throw new IllegalArgumentException("Unwrapped key must be " + KEY_LENGTH + " bytes");
        }
        return key;
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("key must be " + KEY_LENGTH + " bytes");
        }
    }
}
