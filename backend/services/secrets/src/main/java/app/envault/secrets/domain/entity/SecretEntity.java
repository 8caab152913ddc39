package app.envault.secrets.domain.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "secrets", schema = "app_secrets")
public class SecretEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "environment_id", nullable = false, updatable = false)
    private UUID environmentId;

    @Column(name = "path", nullable = false, updatable = false)
    private String path;

    @Column(name = "secret_key", nullable = false, updatable = false)
    private String key;

    @Column(name = "key_hash", nullable = false, updatable = false)
    private String keyHash;

    @Column(name = "description")
    private String description;

    @ElementCollection
    @CollectionTable(name = "secret_tags", schema = "app_secrets", joinColumns = @JoinColumn(name = "secret_id"))
    @Column(name = "tag", nullable = false)
    private Set<String> tags = new LinkedHashSet<>();

    @Column(name = "current_version", nullable = false)
    private int currentVersion;

    @Column(name = "current_version_id", nullable = false)
    private UUID currentVersionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    protected SecretEntity() {
    }

    public SecretEntity(UUID id,
                        UUID organizationId,
                        UUID environmentId,
                        String path,
                        String key,
                        String keyHash,
                        String description,
                        Collection<String> tags,
                        Instant createdAt) {
        this.id = id;
        this.organizationId = organizationId;
        this.environmentId = environmentId;
        this.path = path;
        this.key = key;
        this.keyHash = keyHash;
        this.description = description;
        replaceTags(tags);
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Moves the current-version pointer. Number and id always change together.
     */
    public void pointTo(SecretVersionEntity version, Instant now) {
        if (!id.equals(version.getSecretId())) {
            throw new IllegalArgumentException("Version " + version.getId() + " belongs to another secret");
        }
        this.currentVersion = version.getVersion();
        this.currentVersionId = version.getId();
        this.updatedAt = now;
    }

    public void markDeleted(Instant now) {
        this.deletedAt = now;
        this.updatedAt = now;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void replaceTags(Collection<String> tags) {
        this.tags.clear();
        if (tags != null) {
            this.tags.addAll(tags);
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public UUID getEnvironmentId() {
        return environmentId;
    }

    public String getPath() {
        return path;
    }

    public String getKey() {
        return key;
    }

    public String getKeyHash() {
        return keyHash;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Set<String> getTags() {
        return tags;
    }

    public int getCurrentVersion() {
        return currentVersion;
    }

    public UUID getCurrentVersionId() {
        return currentVersionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}
