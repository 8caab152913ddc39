package app.envault.secrets.service;

import app.envault.secrets.audit.AuditAction;
import app.envault.secrets.audit.AuditEvent;
import app.envault.secrets.audit.AuditEventPublisher;
import app.envault.secrets.domain.dto.OrganizationDTO;
import app.envault.secrets.domain.entity.OrganizationEntity;
import app.envault.secrets.domain.request.ProvisionOrganizationRequest;
import app.envault.secrets.exception.ConflictException;
import app.envault.secrets.repository.OrganizationRepository;
import app.envault.secrets.vault.BlindIndexer;
import app.envault.secrets.vault.EnvelopeCrypto;
import app.envault.secrets.vault.GeneratedKek;
import app.envault.secrets.vault.KeyHierarchyManager;
import app.envault.secrets.vault.KeyMaterial;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.SecureRandom;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrganizationKeyServiceTest {

    @Mock
    OrganizationRepository organizationRepository;

    @Mock
    KeyHierarchyManager keyHierarchyManager;

    @Mock
    BlindIndexer blindIndexer;

    @Mock
    AuditEventPublisher auditEventPublisher;

    OrganizationKeyService service;

    @BeforeEach
    void setup() {
        service = new OrganizationKeyService(organizationRepository, keyHierarchyManager, blindIndexer, auditEventPublisher);
    }

    @Test
    void provisionOrganization_storesWrappedKekAtVersionOneAndWipesRawKek() {
        UUID orgId = UUID.randomUUID();
        UUID actorId = UUID.randomUUID();
        KeyMaterial kek = KeyMaterial.random(new SecureRandom(), EnvelopeCrypto.KEY_LENGTH);
        when(organizationRepository.existsById(orgId)).thenReturn(false);
        when(blindIndexer.newOrganizationSalt()).thenReturn("salt-1");
        when(organizationRepository.existsByBlindIndexSalt("salt-1")).thenReturn(false);
        when(keyHierarchyManager.generateOrgKek()).thenReturn(new GeneratedKek(kek, "wrapped"));
        when(organizationRepository.saveAndFlush(any(OrganizationEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        OrganizationDTO dto = service.provisionOrganization(new ProvisionOrganizationRequest(orgId, " Acme ", actorId));

        assertThat(dto.id()).isEqualTo(orgId);
        assertThat(dto.name()).isEqualTo("Acme");
        assertThat(dto.kekVersion()).isEqualTo(1);
        assertThat(kek.isWiped()).isTrue();

        ArgumentCaptor<OrganizationEntity> saved = ArgumentCaptor.forClass(OrganizationEntity.class);
        verify(organizationRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getEncryptedKek()).isEqualTo("wrapped");
        assertThat(saved.getValue().getBlindIndexSalt()).isEqualTo("salt-1");

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditEventPublisher).publish(event.capture());
        assertThat(event.getValue().action()).isEqualTo(AuditAction.ORGANIZATION_CREATE);
    }

    @Test
    void provisionOrganization_regeneratesCollidingSalt() {
        KeyMaterial kek = KeyMaterial.random(new SecureRandom(), EnvelopeCrypto.KEY_LENGTH);
        when(organizationRepository.existsById(any())).thenReturn(false);
        when(blindIndexer.newOrganizationSalt()).thenReturn("taken", "fresh");
        when(organizationRepository.existsByBlindIndexSalt("taken")).thenReturn(true);
        when(organizationRepository.existsByBlindIndexSalt("fresh")).thenReturn(false);
        when(keyHierarchyManager.generateOrgKek()).thenReturn(new GeneratedKek(kek, "wrapped"));
        when(organizationRepository.saveAndFlush(any(OrganizationEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        service.provisionOrganization(new ProvisionOrganizationRequest(null, "Acme", UUID.randomUUID()));

        ArgumentCaptor<OrganizationEntity> saved = ArgumentCaptor.forClass(OrganizationEntity.class);
        verify(organizationRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getBlindIndexSalt()).isEqualTo("fresh");
        assertThat(saved.getValue().getId()).isNotNull();
    }

    @Test
    void provisionOrganization_rejectsExistingId() {
        UUID orgId = UUID.randomUUID();
        when(organizationRepository.existsById(orgId)).thenReturn(true);

        assertThatThrownBy(() -> service.provisionOrganization(new ProvisionOrganizationRequest(orgId, "Acme", UUID.randomUUID())))
                .isInstanceOf(ConflictException.class);
        verifyNoInteractions(keyHierarchyManager, auditEventPublisher);
    }
}
