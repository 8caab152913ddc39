package app.envault.secrets.service;

import app.envault.secrets.audit.AuditAction;
import app.envault.secrets.audit.AuditEvent;
import app.envault.secrets.audit.AuditEventPublisher;
import app.envault.secrets.domain.dto.BulkUpsertResultDTO;
import app.envault.secrets.domain.dto.KekRotationDTO;
import app.envault.secrets.domain.dto.SecretDTO;
import app.envault.secrets.domain.dto.SecretExportDTO;
import app.envault.secrets.domain.dto.SecretVersionDTO;
import app.envault.secrets.domain.entity.OrganizationEntity;
import app.envault.secrets.domain.entity.SecretEntity;
import app.envault.secrets.domain.entity.SecretVersionEntity;
import app.envault.secrets.domain.request.BulkUpsertRequest;
import app.envault.secrets.domain.request.CreateSecretRequest;
import app.envault.secrets.domain.request.DeleteSecretRequest;
import app.envault.secrets.domain.request.ExportSecretsRequest;
import app.envault.secrets.domain.request.GetSecretRequest;
import app.envault.secrets.domain.request.ListSecretsRequest;
import app.envault.secrets.domain.request.PurgeSecretRequest;
import app.envault.secrets.domain.request.RollbackSecretRequest;
import app.envault.secrets.domain.request.RotateKekRequest;
import app.envault.secrets.domain.request.SecretCoordinates;
import app.envault.secrets.domain.request.UpdateSecretRequest;
import app.envault.secrets.exception.ConflictException;
import app.envault.secrets.exception.NotFoundException;
import app.envault.secrets.repository.OrganizationRepository;
import app.envault.secrets.repository.SecretRepository;
import app.envault.secrets.support.DotenvWriter;
import app.envault.secrets.support.SecretNames;
import app.envault.secrets.vault.BlindIndexer;
import app.envault.secrets.vault.EncryptedSecret;
import app.envault.secrets.vault.KekRotation;
import app.envault.secrets.vault.KeyHierarchyManager;
import app.envault.secrets.vault.KeyMaterial;
import app.envault.secrets.vault.SecretCipher;
import app.envault.secrets.vault.WrappedDek;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Secret lifecycle on top of the key hierarchy.
 * <p>
 * Every operation that touches secrets takes a shared lock on the organization row before anything else,
 * KEK rotation takes it exclusively. Version assignment happens under a row lock on the secret.
 * An unwrapped KEK never outlives the call that unwrapped it.
 */
@Service
public class SecretsService {

    private static final Logger log = LoggerFactory.getLogger(SecretsService.class);
    private static final Sort LIST_ORDER = Sort.by("path", "key");
    static final String ACTIVE_TUPLE_CONSTRAINT = "uq_secrets_active_tuple";

    private final OrganizationRepository organizationRepository;
    private final SecretRepository secretRepository;
    private final SecretVersionStore versionStore;
    private final KeyHierarchyManager keyHierarchyManager;
    private final SecretCipher secretCipher;
    private final BlindIndexer blindIndexer;
    private final AuditEventPublisher auditEventPublisher;
    private final int defaultPageSize;
    private final int maxPageSize;

    public SecretsService(OrganizationRepository organizationRepository,
                          SecretRepository secretRepository,
                          SecretVersionStore versionStore,
                          KeyHierarchyManager keyHierarchyManager,
                          SecretCipher secretCipher,
                          BlindIndexer blindIndexer,
                          AuditEventPublisher auditEventPublisher,
                          @Value("${app.secrets.list.default-page-size:50}") int defaultPageSize,
                          @Value("${app.secrets.list.max-page-size:100}") int maxPageSize) {
        this.organizationRepository = organizationRepository;
        this.secretRepository = secretRepository;
        this.versionStore = versionStore;
        this.keyHierarchyManager = keyHierarchyManager;
        this.secretCipher = secretCipher;
        this.blindIndexer = blindIndexer;
        this.auditEventPublisher = auditEventPublisher;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    @Transactional
    public SecretDTO createSecret(CreateSecretRequest request) {
        SecretCoordinates at = request.coordinates();
        OrganizationEntity organization = lockOrganization(at.organizationId());
        if (secretRepository.existsActive(at.environmentId(), at.path(), at.key())) {
            throw alreadyExists(at);
        }

        Instant now = Instant.now();
        SecretEntity secret;
        SecretVersionEntity version;
        try (KeyMaterial kek = keyHierarchyManager.decryptOrgKek(organization.getEncryptedKek())) {
            EncryptedSecret encrypted = secretCipher.encryptSecret(request.value(), kek, organization.getKekVersion());
            secret = newSecret(organization, at, request.description(), request.tags(), now);
            version = insert(secret, encrypted, request.actorId(), now, at);
        }

        log.info("Secret created secretId={} environmentId={} path={} key={}", secret.getId(), at.environmentId(), at.path(), at.key());
        audit(at.organizationId(), request.actorId(), AuditAction.SECRET_CREATE, secret,
                Map.of("path", at.path(), "environmentId", at.environmentId(), "version", version.getVersion()));
        return toDTO(secret, version, null);
    }

    /**
     * Looks a secret up by its tuple among active secrets. Decrypting the value is audited.
     */
    @Transactional
    public SecretDTO getSecret(GetSecretRequest request) {
        SecretCoordinates at = request.coordinates();
        if (!request.includeValue()) {
            SecretEntity secret = requireActive(at, false);
            return toDTO(secret, versionStore.current(secret), null);
        }

        OrganizationEntity organization = lockOrganization(at.organizationId());
        SecretEntity secret = requireActive(at, false);
        SecretVersionEntity current = versionStore.current(secret);
        String value;
        try (KeyMaterial kek = keyHierarchyManager.decryptOrgKek(organization.getEncryptedKek())) {
            value = secretCipher.decryptSecret(current.toEncryptedSecret(), kek);
        }

        audit(at.organizationId(), request.actorId(), AuditAction.SECRET_READ, secret,
                Map.of("path", at.path(), "version", current.getVersion()));
        return toDTO(secret, current, value);
    }

    /**
     * A new value appends version {@code currentVersion + 1}; description and tags alone only touch the secret row.
     */
    @Transactional
    public SecretDTO updateSecret(UpdateSecretRequest request) {
        if (!request.changesValue() && !request.changesMetadata()) {
            throw new IllegalArgumentException("Nothing to update");
        }
        SecretCoordinates at = request.coordinates();
        OrganizationEntity organization = lockOrganization(at.organizationId());
        SecretEntity secret = requireActive(at, true);
        Instant now = Instant.now();

        applyMetadata(secret, request.description(), request.tags());
        SecretVersionEntity current;
        if (request.changesValue()) {
            try (KeyMaterial kek = keyHierarchyManager.decryptOrgKek(organization.getEncryptedKek())) {
                EncryptedSecret encrypted = secretCipher.encryptSecret(request.value(), kek, organization.getKekVersion());
                current = versionStore.append(secret, encrypted, request.actorId(), now);
            }
        } else {
            secret.setUpdatedAt(now);
            secretRepository.save(secret);
            current = versionStore.current(secret);
        }

        log.info("Secret updated secretId={} version={} valueChanged={}", secret.getId(), current.getVersion(), request.changesValue());
        audit(at.organizationId(), request.actorId(), AuditAction.SECRET_UPDATE, secret,
                Map.of("version", current.getVersion(), "valueChanged", request.changesValue()));
        return toDTO(secret, current, null);
    }

    /**
     * Pages through the active secrets of an environment. With values requested the organization KEK
     * is unwrapped once for the page.
     */
    @Transactional
    public Page<SecretDTO> listSecrets(ListSecretsRequest request) {
        PageRequest pageRequest = pageRequest(request.page(), request.limit());
        List<String> tags = SecretNames.normalizeTags(request.tags());
        boolean anyTag = !tags.isEmpty();

        Optional<OrganizationEntity> locked = request.includeValues()
                ? Optional.of(lockOrganization(request.organizationId()))
                : Optional.empty();
        Page<SecretEntity> page = secretRepository.search(
                request.organizationId(),
                request.environmentId(),
                SecretNames.pathScope(request.pathPrefix()),
                SecretNames.pathPrefixPattern(request.pathPrefix()),
                SecretNames.searchPattern(request.search()),
                anyTag,
                anyTag ? tags : List.of(""),
                pageRequest
        );
        Map<UUID, SecretVersionEntity> current = versionStore.currentOf(page.getContent());

        if (locked.isEmpty() || page.isEmpty()) {
            return page.map(secret -> toDTO(secret, current.get(secret.getId()), null));
        }

        Map<UUID, String> values = new LinkedHashMap<>();
        try (KeyMaterial kek = keyHierarchyManager.decryptOrgKek(locked.get().getEncryptedKek())) {
            for (SecretEntity secret : page.getContent()) {
                values.put(secret.getId(), secretCipher.decryptSecret(current.get(secret.getId()).toEncryptedSecret(), kek));
            }
        }

        auditEventPublisher.publish(AuditEvent.of(
                request.organizationId(),
                request.actorId(),
                AuditAction.SECRET_LIST_WITH_VALUES,
                AuditEvent.ENVIRONMENT,
                request.environmentId(),
                null,
                Map.of("count", values.size(), "page", pageRequest.getPageNumber() + 1)
        ));
        return page.map(secret -> toDTO(secret, current.get(secret.getId()), values.get(secret.getId())));
    }

    /**
     * Soft delete keeps the version chain and frees the tuple for a new secret; permanent delete removes both.
     */
    @Transactional
    public void deleteSecret(DeleteSecretRequest request) {
        SecretCoordinates at = request.coordinates();
        lockOrganization(at.organizationId());
        SecretEntity secret = requireActive(at, true);

        if (request.permanent()) {
            versionStore.purge(secret);
        } else {
            secret.markDeleted(Instant.now());
            secretRepository.saveAndFlush(secret);
        }

        log.info("Secret deleted secretId={} permanent={}", secret.getId(), request.permanent());
        audit(at.organizationId(), request.actorId(),
                request.permanent() ? AuditAction.SECRET_DELETE_PERMANENT : AuditAction.SECRET_DELETE,
                secret, Map.of("path", at.path()));
    }

    /**
     * Permanently removes a secret and its whole version chain by id. Unlike {@link #deleteSecret} this also
     * reaches soft-deleted secrets, whose tuple may already belong to a newer secret.
     */
    @Transactional
    public void purgeSecret(PurgeSecretRequest request) {
        lockOrganization(request.organizationId());
        SecretEntity secret = secretRepository.findByIdForUpdate(request.organizationId(), request.secretId())
                .orElseThrow(() -> new NotFoundException("Secret " + request.secretId() + " not found"));
        boolean wasDeleted = secret.isDeleted();
        versionStore.purge(secret);

        log.info("Secret purged secretId={} wasDeleted={}", secret.getId(), wasDeleted);
        audit(request.organizationId(), request.actorId(), AuditAction.SECRET_DELETE_PERMANENT, secret,
                Map.of("path", secret.getPath(), "wasDeleted", wasDeleted));
    }

    @Transactional(readOnly = true)
    public List<SecretVersionDTO> getSecretVersions(UUID organizationId, UUID secretId) {
        SecretEntity secret = secretRepository.findByIdAndOrganizationId(secretId, organizationId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> new NotFoundException("Secret " + secretId + " not found"));
        return versionStore.history(secret.getId()).stream()
                .map(version -> new SecretVersionDTO(
                        version.getId(),
                        version.getVersion(),
                        version.getKekVersion(),
                        version.getAlgorithm(),
                        version.getId().equals(secret.getCurrentVersionId()),
                        version.getCreatedBy(),
                        version.getCreatedAt()))
                .toList();
    }

    /**
     * Appends a verbatim copy of {@code targetVersion} as the new current version. History is never rewritten.
     */
    @Transactional
    public SecretDTO rollbackToVersion(RollbackSecretRequest request) {
        lockOrganization(request.organizationId());
        SecretEntity secret = secretRepository.findByIdForUpdate(request.organizationId(), request.secretId())
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> new NotFoundException("Secret " + request.secretId() + " not found"));
        SecretVersionEntity target = versionStore.require(secret.getId(), request.targetVersion());

        int fromVersion = secret.getCurrentVersion();
        SecretVersionEntity appended = versionStore.appendCopyOf(secret, target, request.actorId(), Instant.now());

        log.info("Secret rolled back secretId={} fromVersion={} toVersion={} newVersion={}",
                secret.getId(), fromVersion, target.getVersion(), appended.getVersion());
        audit(request.organizationId(), request.actorId(), AuditAction.SECRET_ROLLBACK, secret,
                Map.of("fromVersion", fromVersion, "toVersion", target.getVersion(), "newVersion", appended.getVersion()));
        return toDTO(secret, appended, null);
    }

    /**
     * Re-wraps the DEK of every version of every secret in the organization, soft-deleted ones included,
     * under a freshly generated KEK. Ciphertexts are not touched. Any failure rolls the whole rotation back.
     */
    @Transactional
    public KekRotationDTO rotateOrganizationKek(RotateKekRequest request) {
        OrganizationEntity organization = organizationRepository.findByIdForUpdate(request.organizationId())
                .orElseThrow(() -> organizationNotFound(request.organizationId()));
        List<SecretVersionEntity> versions = versionStore.allOfOrganization(organization.getId());
        List<WrappedDek> deks = versions.stream()
                .map(version -> new WrappedDek(version.getId(), version.getEncryptedDek()))
                .toList();

        int previousVersion = organization.getKekVersion();
        KekRotation rotation = keyHierarchyManager.rotateOrgKek(organization.getEncryptedKek(), previousVersion, deks);

        Map<UUID, String> rewrapped = rotation.updatedDeks().stream()
                .collect(Collectors.toMap(WrappedDek::versionId, WrappedDek::encryptedDek));
        for (SecretVersionEntity version : versions) {
            String encryptedDek = rewrapped.get(version.getId());
            if (encryptedDek == null) {
                throw new IllegalStateException("Rotation produced no DEK for secret version " + version.getId());
            }
            version.rewrap(encryptedDek, rotation.newVersion());
        }
        Instant now = Instant.now();
        organization.replaceKek(rotation.newEncryptedKek(), rotation.newVersion(), now);
        organizationRepository.saveAndFlush(organization);

        log.info("Organization KEK rotated organizationId={} previousVersion={} newVersion={} rewrappedDeks={}",
                organization.getId(), previousVersion, rotation.newVersion(), versions.size());
        auditEventPublisher.publish(AuditEvent.of(
                organization.getId(),
                request.actorId(),
                AuditAction.ORGANIZATION_KEK_ROTATE,
                AuditEvent.ORGANIZATION,
                organization.getId(),
                organization.getName(),
                Map.of("previousVersion", previousVersion, "newVersion", rotation.newVersion(), "rewrappedDeks", versions.size())
        ));
        return new KekRotationDTO(organization.getId(), previousVersion, rotation.newVersion(), versions.size(), now);
    }

    /**
     * Finds active secrets with the given key anywhere in the environment by blind index. Nothing is decrypted.
     */
    @Transactional(readOnly = true)
    public List<SecretDTO> findByName(UUID organizationId, UUID environmentId, String key) {
        String normalizedKey = SecretNames.requireKey(key);
        OrganizationEntity organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> organizationNotFound(organizationId));
        String keyHash = blindIndexer.createBlindIndex(normalizedKey, organization.getBlindIndexSalt());
        List<SecretEntity> matches = secretRepository.findActiveByKeyHash(organizationId, environmentId, keyHash);
        Map<UUID, SecretVersionEntity> current = versionStore.currentOf(matches);
        return matches.stream()
                .map(secret -> toDTO(secret, current.get(secret.getId()), null))
                .toList();
    }

    /**
     * Creates or updates every entry in one transaction with a single KEK unwrap. Entries are processed
     * in (path, key) order so concurrent bulk calls lock rows in the same order.
     */
    @Transactional
    public BulkUpsertResultDTO bulkUpsert(BulkUpsertRequest request) {
        List<Pending> pending = new ArrayList<>(request.entries().size());
        Set<SecretCoordinates> seen = new HashSet<>();
        for (BulkUpsertRequest.Entry entry : request.entries()) {
            SecretCoordinates at = new SecretCoordinates(request.organizationId(), request.environmentId(), entry.path(), entry.key());
            if (!seen.add(at)) {
                throw new IllegalArgumentException("Duplicate entry for key " + at.key() + " at path " + at.path());
            }
            pending.add(new Pending(at, entry));
        }
        pending.sort(Comparator.comparing((Pending p) -> p.at().path()).thenComparing(p -> p.at().key()));

        OrganizationEntity organization = lockOrganization(request.organizationId());
        Instant now = Instant.now();
        int created = 0;
        int updated = 0;
        List<SecretDTO> results = new ArrayList<>(pending.size());
        try (KeyMaterial kek = keyHierarchyManager.decryptOrgKek(organization.getEncryptedKek())) {
            for (Pending item : pending) {
                SecretCoordinates at = item.at();
                BulkUpsertRequest.Entry entry = item.entry();
                EncryptedSecret encrypted = secretCipher.encryptSecret(entry.value(), kek, organization.getKekVersion());
                Optional<SecretEntity> existing = secretRepository.findActiveForUpdate(at.organizationId(), at.environmentId(), at.path(), at.key());
                if (existing.isPresent()) {
                    SecretEntity secret = existing.get();
                    applyMetadata(secret, entry.description(), entry.tags());
                    SecretVersionEntity version = versionStore.append(secret, encrypted, request.actorId(), now);
                    results.add(toDTO(secret, version, null));
                    updated++;
                } else {
                    SecretEntity secret = newSecret(organization, at, entry.description(), entry.tags(), now);
                    SecretVersionEntity version = insert(secret, encrypted, request.actorId(), now, at);
                    results.add(toDTO(secret, version, null));
                    created++;
                }
            }
        }

        log.info("Secrets bulk upserted environmentId={} created={} updated={}", request.environmentId(), created, updated);
        auditEventPublisher.publish(AuditEvent.of(
                request.organizationId(),
                request.actorId(),
                AuditAction.SECRET_BULK_UPSERT,
                AuditEvent.ENVIRONMENT,
                request.environmentId(),
                null,
                Map.of("created", created, "updated", updated)
        ));
        return new BulkUpsertResultDTO(created, updated, results);
    }

    /**
     * Renders the active secrets of an environment as dotenv text. Keys must be unique under the prefix,
     * dotenv has no notion of paths.
     */
    @Transactional
    public SecretExportDTO exportSecrets(ExportSecretsRequest request) {
        String pathPrefix = request.pathPrefix() == null || request.pathPrefix().isBlank()
                ? SecretNames.ROOT_PATH
                : SecretNames.normalizePath(request.pathPrefix());
        OrganizationEntity organization = lockOrganization(request.organizationId());
        List<SecretEntity> secrets = secretRepository.findActiveUnderPath(
                request.organizationId(),
                request.environmentId(),
                SecretNames.pathScope(pathPrefix),
                SecretNames.pathPrefixPattern(pathPrefix));

        Map<String, SecretEntity> byKey = new LinkedHashMap<>();
        for (SecretEntity secret : secrets) {
            SecretEntity clash = byKey.putIfAbsent(secret.getKey(), secret);
            if (clash != null) {
                throw new ConflictException("Key " + secret.getKey() + " exists at both " + clash.getPath()
                        + " and " + secret.getPath() + "; narrow the path prefix");
            }
        }

        Map<UUID, SecretVersionEntity> current = versionStore.currentOf(secrets);
        Map<String, String> entries = new LinkedHashMap<>();
        if (!secrets.isEmpty()) {
            try (KeyMaterial kek = keyHierarchyManager.decryptOrgKek(organization.getEncryptedKek())) {
                for (SecretEntity secret : byKey.values()) {
                    entries.put(secret.getKey(), secretCipher.decryptSecret(current.get(secret.getId()).toEncryptedSecret(), kek));
                }
            }
        }

        auditEventPublisher.publish(AuditEvent.of(
                request.organizationId(),
                request.actorId(),
                AuditAction.SECRET_EXPORT,
                AuditEvent.ENVIRONMENT,
                request.environmentId(),
                pathPrefix,
                Map.of("count", entries.size(), "format", "dotenv")
        ));
        return new SecretExportDTO(request.environmentId(), pathPrefix, entries.size(), DotenvWriter.write(entries));
    }

    private OrganizationEntity lockOrganization(UUID organizationId) {
        return organizationRepository.findByIdForShare(organizationId)
                .orElseThrow(() -> organizationNotFound(organizationId));
    }

    private SecretEntity requireActive(SecretCoordinates at, boolean forUpdate) {
        Optional<SecretEntity> found = forUpdate
                ? secretRepository.findActiveForUpdate(at.organizationId(), at.environmentId(), at.path(), at.key())
                : secretRepository.findActive(at.organizationId(), at.environmentId(), at.path(), at.key());
        return found.orElseThrow(() -> new NotFoundException("Secret " + at.key() + " not found at path " + at.path()));
    }

    private SecretEntity newSecret(OrganizationEntity organization,
                                   SecretCoordinates at,
                                   String description,
                                   List<String> tags,
                                   Instant now) {
        String keyHash = blindIndexer.createBlindIndex(at.key(), organization.getBlindIndexSalt());
        return new SecretEntity(
                UUID.randomUUID(),
                organization.getId(),
                at.environmentId(),
                at.path(),
                at.key(),
                keyHash,
                normalizeDescription(description),
                SecretNames.normalizeTags(tags),
                now
        );
    }

    // The partial unique index on active tuples decides between concurrent creates.
    private SecretVersionEntity insert(SecretEntity secret, EncryptedSecret encrypted, UUID actorId, Instant now, SecretCoordinates at) {
        try {
            return versionStore.createWithFirstVersion(secret, encrypted, actorId, now);
        } catch (DataIntegrityViolationException ex) {
            if (violates(ex, ACTIVE_TUPLE_CONSTRAINT)) {
                throw new ConflictException("Secret " + at.key() + " already exists at path " + at.path(), ex);
            }
            throw ex;
        }
    }

    static boolean violates(DataIntegrityViolationException ex, String constraint) {
        String message = ex.getMostSpecificCause().getMessage();
        return message != null && message.contains(constraint);
    }

    private static void applyMetadata(SecretEntity secret, String description, List<String> tags) {
        if (description != null) {
            secret.setDescription(normalizeDescription(description));
        }
        if (tags != null) {
            secret.replaceTags(SecretNames.normalizeTags(tags));
        }
    }

    private static String normalizeDescription(String description) {
        return description == null || description.isBlank() ? null : description.trim();
    }

    private PageRequest pageRequest(Integer page, Integer limit) {
        int pageNumber = page == null ? 1 : page;
        if (pageNumber < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        int size = limit == null ? defaultPageSize : limit;
        if (size < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        return PageRequest.of(pageNumber - 1, Math.min(size, maxPageSize), LIST_ORDER);
    }

    private void audit(UUID organizationId, UUID actorId, AuditAction action, SecretEntity secret, Map<String, Object> metadata) {
        auditEventPublisher.publish(AuditEvent.of(
                organizationId, actorId, action, AuditEvent.SECRET, secret.getId(), secret.getKey(), metadata));
    }

    private static ConflictException alreadyExists(SecretCoordinates at) {
        return new ConflictException("Secret " + at.key() + " already exists at path " + at.path());
    }

    private static NotFoundException organizationNotFound(UUID organizationId) {
        return new NotFoundException("Organization " + organizationId + " not found");
    }

    static SecretDTO toDTO(SecretEntity secret, SecretVersionEntity current, String value) {
        return new SecretDTO(
                secret.getId(),
                secret.getEnvironmentId(),
                secret.getPath(),
                secret.getKey(),
                value,
                current.getVersion(),
                current.getId(),
                current.getKekVersion(),
                secret.getDescription(),
                List.copyOf(secret.getTags()),
                current.getCreatedBy(),
                secret.getCreatedAt(),
                secret.getUpdatedAt()
        );
    }

    private record Pending(SecretCoordinates at, BulkUpsertRequest.Entry entry) {
    }
}
