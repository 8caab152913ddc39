package app.envault.secrets.domain.entity;

import app.envault.secrets.vault.EncryptedSecret;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable link of a secret's version chain. The only columns that ever change after insert are
 * {@code encrypted_dek} and {@code kek_version}, and only together, during KEK rotation.
 */
@Entity
@Table(name = "secret_versions", schema = "app_secrets")
public class SecretVersionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "secret_id", nullable = false, updatable = false)
    private UUID secretId;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @Column(name = "encrypted_value", nullable = false, updatable = false)
    private String encryptedValue;

    @Column(name = "iv", nullable = false, updatable = false)
    private String iv;

    @Column(name = "auth_tag", nullable = false, updatable = false)
    private String authTag;

    @Column(name = "encrypted_dek", nullable = false)
    private String encryptedDek;

    @Column(name = "algorithm", nullable = false, updatable = false)
    private String algorithm;

    @Column(name = "kek_version", nullable = false)
    private int kekVersion;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SecretVersionEntity() {
    }

    public SecretVersionEntity(UUID id,
                               UUID secretId,
                               int version,
                               EncryptedSecret encrypted,
                               UUID createdBy,
                               Instant createdAt) {
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        this.id = id;
        this.secretId = secretId;
        this.version = version;
        this.encryptedValue = encrypted.ciphertext();
        this.iv = encrypted.iv();
        this.authTag = encrypted.authTag();
        this.encryptedDek = encrypted.encryptedDek();
        this.algorithm = encrypted.algorithm();
        this.kekVersion = encrypted.keyVersion();
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public EncryptedSecret toEncryptedSecret() {
        return new EncryptedSecret(encryptedValue, iv, authTag, encryptedDek, algorithm, kekVersion);
    }

    public void rewrap(String encryptedDek, int kekVersion) {
        this.encryptedDek = encryptedDek;
        this.kekVersion = kekVersion;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSecretId() {
        return secretId;
    }

    public int getVersion() {
        return version;
    }

    public String getEncryptedValue() {
        return encryptedValue;
    }

    public String getIv() {
        return iv;
    }

    public String getAuthTag() {
        return authTag;
    }

    public String getEncryptedDek() {
        return encryptedDek;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public int getKekVersion() {
        return kekVersion;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
