package app.envault.secrets.repository;

import app.envault.secrets.domain.entity.SecretVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SecretVersionRepository extends JpaRepository<SecretVersionEntity, UUID> {

    Optional<SecretVersionEntity> findBySecretIdAndVersion(UUID secretId, int version);

    List<SecretVersionEntity> findBySecretIdOrderByVersionDesc(UUID secretId);

    List<SecretVersionEntity> findByIdIn(Collection<UUID> ids);

    // Soft-deleted secrets included: their history must stay decryptable after a rotation.
    @Query("""
        select v from SecretVersionEntity v
        where v.secretId in (select s.id from SecretEntity s where s.organizationId = :organizationId)
        """)
    List<SecretVersionEntity> findAllByOrganizationId(@Param("organizationId") UUID organizationId);

    @Modifying
    @Query("delete from SecretVersionEntity v where v.secretId = :secretId")
    int deleteAllBySecretId(@Param("secretId") UUID secretId);
}
