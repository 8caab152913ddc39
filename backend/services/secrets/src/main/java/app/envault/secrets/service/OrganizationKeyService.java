package app.envault.secrets.service;

import app.envault.secrets.audit.AuditAction;
import app.envault.secrets.audit.AuditEvent;
import app.envault.secrets.audit.AuditEventPublisher;
import app.envault.secrets.domain.dto.OrganizationDTO;
import app.envault.secrets.domain.entity.OrganizationEntity;
import app.envault.secrets.domain.request.ProvisionOrganizationRequest;
import app.envault.secrets.exception.ConflictException;
import app.envault.secrets.exception.NotFoundException;
import app.envault.secrets.repository.OrganizationRepository;
import app.envault.secrets.vault.BlindIndexer;
import app.envault.secrets.vault.GeneratedKek;
import app.envault.secrets.vault.KeyHierarchyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Provisions organizations with their first wrapped KEK and a blind-index salt no other organization shares.
 */
@Service
public class OrganizationKeyService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationKeyService.class);
    private static final int SALT_ATTEMPTS = 3;

    private final OrganizationRepository organizationRepository;
    private final KeyHierarchyManager keyHierarchyManager;
    private final BlindIndexer blindIndexer;
    private final AuditEventPublisher auditEventPublisher;

    public OrganizationKeyService(OrganizationRepository organizationRepository,
                                  KeyHierarchyManager keyHierarchyManager,
                                  BlindIndexer blindIndexer,
                                  AuditEventPublisher auditEventPublisher) {
        this.organizationRepository = organizationRepository;
        this.keyHierarchyManager = keyHierarchyManager;
        this.blindIndexer = blindIndexer;
        this.auditEventPublisher = auditEventPublisher;
    }

    @Transactional
    public OrganizationDTO provisionOrganization(ProvisionOrganizationRequest request) {
        UUID organizationId = request.organizationId() == null ? UUID.randomUUID() : request.organizationId();
        if (organizationRepository.existsById(organizationId)) {
            throw new ConflictException("Organization " + organizationId + " already exists");
        }
        String salt = uniqueSalt();
        Instant now = Instant.now();

        OrganizationEntity saved;
        try (GeneratedKek kek = keyHierarchyManager.generateOrgKek()) {
            OrganizationEntity organization = new OrganizationEntity(organizationId, request.name(), kek.encryptedKek(), 1, salt, now);
            saved = organizationRepository.saveAndFlush(organization);
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("Organization " + organizationId + " could not be provisioned", ex);
        }

        log.info("Organization provisioned organizationId={} kekVersion={}", saved.getId(), saved.getKekVersion());
        auditEventPublisher.publish(AuditEvent.of(
                saved.getId(),
                request.actorId(),
                AuditAction.ORGANIZATION_CREATE,
                AuditEvent.ORGANIZATION,
                saved.getId(),
                saved.getName(),
                Map.of("kekVersion", saved.getKekVersion())
        ));
        return toDTO(saved);
    }

    @Transactional(readOnly = true)
    public OrganizationDTO getOrganization(UUID organizationId) {
        return organizationRepository.findById(organizationId)
                .map(OrganizationKeyService::toDTO)
                .orElseThrow(() -> new NotFoundException("Organization " + organizationId + " not found"));
    }

    // The unique index on blind_index_salt is the final guard; this only avoids a doomed insert.
    private String uniqueSalt() {
        for (int attempt = 0; attempt < SALT_ATTEMPTS; attempt++) {
            String salt = blindIndexer.newOrganizationSalt();
            if (!organizationRepository.existsByBlindIndexSalt(salt)) {
                return salt;
            }
            log.warn("Blind index salt collision, regenerating attempt={}", attempt + 1);
        }
        throw new IllegalStateException("Could not generate a unique blind index salt");
    }

    static OrganizationDTO toDTO(OrganizationEntity entity) {
        return new OrganizationDTO(
                entity.getId(),
                entity.getName(),
                entity.getKekVersion(),
                entity.getCreatedAt(),
                entity.getKekRotatedAt()
        );
    }
}
