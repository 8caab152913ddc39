package app.envault.secrets.repository;

import app.envault.secrets.domain.entity.OrganizationEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrganizationRepository extends JpaRepository<OrganizationEntity, UUID> {

    // Held by every secret operation; blocks only while a KEK rotation holds the row exclusively.
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select o from OrganizationEntity o where o.id = :id")
    Optional<OrganizationEntity> findByIdForShare(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from OrganizationEntity o where o.id = :id")
    Optional<OrganizationEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByBlindIndexSalt(String blindIndexSalt);
}
