package app.envault.secrets.vault;

import app.envault.secrets.exception.DecryptionFailedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretCipherTest {

    private final SecretCipher cipher = new SecretCipher(new EnvelopeCrypto());
    private final KeyMaterial kek = KeyMaterial.random(new SecureRandom(), EnvelopeCrypto.KEY_LENGTH);

    @AfterEach
    void wipe() {
        kek.close();
    }

    @Test
    void encryptSecret_roundTripsUnicode() {
        EncryptedSecret encrypted = cipher.encryptSecret("пароль ✓ s3cr3t!", kek, 3);

        assertThat(encrypted.algorithm()).isEqualTo("aes-256-gcm");
        assertThat(encrypted.keyVersion()).isEqualTo(3);
        assertThat(Base64.getDecoder().decode(encrypted.iv())).hasSize(16);
        assertThat(Base64.getDecoder().decode(encrypted.authTag())).hasSize(16);
        assertThat(cipher.decryptSecret(encrypted, kek)).isEqualTo("пароль ✓ s3cr3t!");
    }

    @Test
    void encryptSecret_usesFreshDekEachTime() {
        EncryptedSecret first = cipher.encryptSecret("same", kek, 1);
        EncryptedSecret second = cipher.encryptSecret("same", kek, 1);

        assertThat(first.encryptedDek()).isNotEqualTo(second.encryptedDek());
        assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
    }

    @Test
    void decryptSecret_wipesPlaintextBytesAfterDecoding() {
        List<byte[]> handedOut = new ArrayList<>();
        SecretCipher recording = new SecretCipher(new EnvelopeCrypto() {
            @Override
            public byte[] decrypt(byte[] key, byte[] iv, byte[] ciphertext, byte[] authTag) {
                byte[] plaintext = super.decrypt(key, iv, ciphertext, authTag);
                handedOut.add(plaintext);
                return plaintext;
            }
        });
        EncryptedSecret encrypted = recording.encryptSecret("db-password", kek, 1);

        assertThat(recording.decryptSecret(encrypted, kek)).isEqualTo("db-password");
        // unwrapping the DEK goes through the same method, so the DEK comes first and the value second
        assertThat(handedOut).hasSize(2);
        assertThat(handedOut.get(1)).hasSize("db-password".length());
        assertThat(handedOut).allSatisfy(bytes -> assertThat(bytes).containsOnly((byte) 0));
    }

    @Test
    void encryptSecret_wipesPlaintextBytesAfterSealing() {
        List<byte[]> received = new ArrayList<>();
        SecretCipher recording = new SecretCipher(new EnvelopeCrypto() {
            @Override
            public SealedBox encrypt(byte[] key, byte[] plaintext) {
                received.add(plaintext);
                return super.encrypt(key, plaintext);
            }
        });

        EncryptedSecret encrypted = recording.encryptSecret("db-password", kek, 1);

        // wrapping the DEK goes through encrypt as well
        assertThat(received).hasSize(2);
        assertThat(received.get(1)).hasSize("db-password".length());
        assertThat(received).allSatisfy(bytes -> assertThat(bytes).containsOnly((byte) 0));
        assertThat(cipher.decryptSecret(encrypted, kek)).isEqualTo("db-password");
    }

    @Test
    void decryptSecret_rejectsTamperedCiphertext() {
        EncryptedSecret encrypted = cipher.encryptSecret("value", kek, 1);
        byte[] ciphertext = Base64.getDecoder().decode(encrypted.ciphertext());
        ciphertext[0] ^= 0x01;
        EncryptedSecret tampered = new EncryptedSecret(Base64.getEncoder().encodeToString(ciphertext), encrypted.iv(),
                encrypted.authTag(), encrypted.encryptedDek(), encrypted.algorithm(), encrypted.keyVersion());

        assertThatThrownBy(() -> cipher.decryptSecret(tampered, kek))
                .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void decryptSecret_rejectsTamperedAuthTag() {
        EncryptedSecret encrypted = cipher.encryptSecret("value", kek, 1);
        byte[] tag = Base64.getDecoder().decode(encrypted.authTag());
        tag[3] ^= 0x10;
        EncryptedSecret tampered = new EncryptedSecret(encrypted.ciphertext(), encrypted.iv(),
                Base64.getEncoder().encodeToString(tag), encrypted.encryptedDek(), encrypted.algorithm(), encrypted.keyVersion());

        assertThatThrownBy(() -> cipher.decryptSecret(tampered, kek))
                .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void decryptSecret_rejectsTamperedEncryptedDek() {
        EncryptedSecret encrypted = cipher.encryptSecret("value", kek, 1);
        String[] parts = encrypted.encryptedDek().split(":");
        byte[] wrappedDek = Base64.getDecoder().decode(parts[2]);
        wrappedDek[0] ^= 0x01;
        String tamperedDek = parts[0] + ":" + parts[1] + ":" + Base64.getEncoder().encodeToString(wrappedDek);
        EncryptedSecret tampered = new EncryptedSecret(encrypted.ciphertext(), encrypted.iv(), encrypted.authTag(),
                tamperedDek, encrypted.algorithm(), encrypted.keyVersion());

        assertThatThrownBy(() -> cipher.decryptSecret(tampered, kek))
                .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void decryptSecret_rejectsWrongKek() {
        EncryptedSecret encrypted = cipher.encryptSecret("value", kek, 1);

        try (KeyMaterial other = KeyMaterial.random(new SecureRandom(), EnvelopeCrypto.KEY_LENGTH)) {
            assertThatThrownBy(() -> cipher.decryptSecret(encrypted, other))
                    .isInstanceOf(DecryptionFailedException.class);
        }
    }

    @Test
    void decryptSecret_rejectsUnknownAlgorithm() {
        EncryptedSecret encrypted = cipher.encryptSecret("value", kek, 1);
        EncryptedSecret relabeled = new EncryptedSecret(encrypted.ciphertext(), encrypted.iv(), encrypted.authTag(),
                encrypted.encryptedDek(), "aes-128-cbc", encrypted.keyVersion());

        assertThatThrownBy(() -> cipher.decryptSecret(relabeled, kek))
                .isInstanceOf(DecryptionFailedException.class)
                .hasMessageContaining("aes-128-cbc");
    }
}
