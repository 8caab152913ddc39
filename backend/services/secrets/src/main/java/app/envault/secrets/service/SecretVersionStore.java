package app.envault.secrets.service;

import app.envault.secrets.domain.entity.SecretEntity;
import app.envault.secrets.domain.entity.SecretVersionEntity;
import app.envault.secrets.exception.NotFoundException;
import app.envault.secrets.repository.SecretRepository;
import app.envault.secrets.repository.SecretVersionRepository;
import app.envault.secrets.vault.EncryptedSecret;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only version chain per secret. Every append writes the version row and moves the secret's
 * current-version pointer in the caller's transaction, so the pair is never observed out of step.
 * Appends to an existing chain require the secret row to be locked by the caller.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class SecretVersionStore {

    private final SecretRepository secretRepository;
    private final SecretVersionRepository versionRepository;

    public SecretVersionStore(SecretRepository secretRepository,
                              SecretVersionRepository versionRepository) {
        this.secretRepository = secretRepository;
        this.versionRepository = versionRepository;
    }

    /**
     * Inserts a brand-new secret together with version 1. Flushes, so a uniqueness violation surfaces here.
     */
    public SecretVersionEntity createWithFirstVersion(SecretEntity secret, EncryptedSecret encrypted, UUID actorId, Instant now) {
        SecretVersionEntity first = new SecretVersionEntity(UUID.randomUUID(), secret.getId(), 1, encrypted, actorId, now);
        secret.pointTo(first, now);
        secretRepository.saveAndFlush(secret);
        versionRepository.saveAndFlush(first);
        return first;
    }

    public SecretVersionEntity append(SecretEntity lockedSecret, EncryptedSecret encrypted, UUID actorId, Instant now) {
        int next = lockedSecret.getCurrentVersion() + 1;
        SecretVersionEntity version = new SecretVersionEntity(UUID.randomUUID(), lockedSecret.getId(), next, encrypted, actorId, now);
        return link(lockedSecret, version, now);
    }

    /**
     * Appends a verbatim copy of {@code source}: same ciphertext, iv, tag, wrapped DEK and KEK version.
     * No decryption is involved, history is left untouched.
     */
    public SecretVersionEntity appendCopyOf(SecretEntity lockedSecret, SecretVersionEntity source, UUID actorId, Instant now) {
        if (!lockedSecret.getId().equals(source.getSecretId())) {
            throw new IllegalArgumentException("Version " + source.getVersion() + " belongs to another secret");
        }
        return append(lockedSecret, source.toEncryptedSecret(), actorId, now);
    }

    public SecretVersionEntity current(SecretEntity secret) {
        SecretVersionEntity version = versionRepository.findById(secret.getCurrentVersionId())
                .orElseThrow(() -> new IllegalStateException("Current version pointer of secret " + secret.getId() + " is dangling"));
        if (version.getVersion() != secret.getCurrentVersion()) {
            throw new IllegalStateException("Current version pointer of secret " + secret.getId() + " is inconsistent");
        }
        return version;
    }

    public Map<UUID, SecretVersionEntity> currentOf(Collection<SecretEntity> secrets) {
        if (secrets.isEmpty()) {
            return Map.of();
        }
        List<UUID> ids = secrets.stream().map(SecretEntity::getCurrentVersionId).toList();
        Map<UUID, SecretVersionEntity> byId = versionRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(SecretVersionEntity::getId, Function.identity()));
        return secrets.stream()
                .collect(Collectors.toMap(SecretEntity::getId, secret -> {
                    SecretVersionEntity version = byId.get(secret.getCurrentVersionId());
                    if (version == null || version.getVersion() != secret.getCurrentVersion()) {
                        throw new IllegalStateException("Current version pointer of secret " + secret.getId() + " is inconsistent");
                    }
                    return version;
                }));
    }

    public SecretVersionEntity require(UUID secretId, int version) {
        return find(secretId, version)
                .orElseThrow(() -> new NotFoundException("Version " + version + " of secret " + secretId + " not found"));
    }

    public Optional<SecretVersionEntity> find(UUID secretId, int version) {
        return versionRepository.findBySecretIdAndVersion(secretId, version);
    }

    public List<SecretVersionEntity> history(UUID secretId) {
        return versionRepository.findBySecretIdOrderByVersionDesc(secretId);
    }

    public List<SecretVersionEntity> allOfOrganization(UUID organizationId) {
        return versionRepository.findAllByOrganizationId(organizationId);
    }

    /**
     * Removes the secret and its whole version chain. Irreversible.
     */
    public void purge(SecretEntity secret) {
        versionRepository.deleteAllBySecretId(secret.getId());
        secretRepository.delete(secret);
        secretRepository.flush();
    }

    private SecretVersionEntity link(SecretEntity lockedSecret, SecretVersionEntity version, Instant now) {
        versionRepository.saveAndFlush(version);
        lockedSecret.pointTo(version, now);
        secretRepository.saveAndFlush(lockedSecret);
        return version;
    }
}
