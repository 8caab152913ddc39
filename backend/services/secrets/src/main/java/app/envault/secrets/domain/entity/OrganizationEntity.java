package app.envault.secrets.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "organizations", schema = "app_secrets")
public class OrganizationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    // iv:authTag:ciphertext under the master key
    @Column(name = "encrypted_kek", nullable = false)
    private String encryptedKek;

    @Column(name = "kek_version", nullable = false)
    private int kekVersion;

    @Column(name = "blind_index_salt", nullable = false, updatable = false)
    private String blindIndexSalt;

    @Column(name = "kek_rotated_at")
    private Instant kekRotatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected OrganizationEntity() {
    }

    public OrganizationEntity(UUID id,
                              String name,
                              String encryptedKek,
                              int kekVersion,
                              String blindIndexSalt,
                              Instant createdAt) {
        this.id = id;
        this.name = name;
        this.encryptedKek = encryptedKek;
        this.kekVersion = kekVersion;
        this.blindIndexSalt = blindIndexSalt;
        this.createdAt = createdAt;
    }

    /**
     * Replaces the wrapped KEK wholesale. Only valid together with re-wrapping every DEK in the same transaction.
     */
    public void replaceKek(String encryptedKek, int kekVersion, Instant rotatedAt) {
        if (kekVersion <= this.kekVersion) {
            throw new IllegalArgumentException("KEK version must increase: " + this.kekVersion + " -> " + kekVersion);
        }
        this.encryptedKek = encryptedKek;
        this.kekVersion = kekVersion;
        this.kekRotatedAt = rotatedAt;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEncryptedKek() {
        return encryptedKek;
    }

    public int getKekVersion() {
        return kekVersion;
    }

    public String getBlindIndexSalt() {
        return blindIndexSalt;
    }

    public Instant getKekRotatedAt() {
        return kekRotatedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
