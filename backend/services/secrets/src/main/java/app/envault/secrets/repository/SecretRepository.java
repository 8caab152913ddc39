package app.envault.secrets.repository;

import app.envault.secrets.domain.entity.SecretEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SecretRepository extends JpaRepository<SecretEntity, UUID> {

    @Query("""
        select s from SecretEntity s
        where s.organizationId = :organizationId
          and s.environmentId = :environmentId
          and s.path = :path
          and s.key = :key
          and s.deletedAt is null
        """)
    Optional<SecretEntity> findActive(@Param("organizationId") UUID organizationId,
                                      @Param("environmentId") UUID environmentId,
                                      @Param("path") String path,
                                      @Param("key") String key);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select s from SecretEntity s
        where s.organizationId = :organizationId
          and s.environmentId = :environmentId
          and s.path = :path
          and s.key = :key
          and s.deletedAt is null
        """)
    Optional<SecretEntity> findActiveForUpdate(@Param("organizationId") UUID organizationId,
                                               @Param("environmentId") UUID environmentId,
                                               @Param("path") String path,
                                               @Param("key") String key);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SecretEntity s where s.id = :id and s.organizationId = :organizationId")
    Optional<SecretEntity> findByIdForUpdate(@Param("organizationId") UUID organizationId,
                                             @Param("id") UUID id);

    Optional<SecretEntity> findByIdAndOrganizationId(UUID id, UUID organizationId);

    @Query("""
        select count(s) > 0 from SecretEntity s
        where s.environmentId = :environmentId
          and s.path = :path
          and s.key = :key
          and s.deletedAt is null
        """)
    boolean existsActive(@Param("environmentId") UUID environmentId,
                         @Param("path") String path,
                         @Param("key") String key);

    /**
     * {@code pathPrefix} is the normalized path the filter is anchored at and {@code pathPattern} the escaped
     * LIKE pattern for everything below it; both empty match all paths. {@code search} is an escaped LIKE fragment.
     * When {@code anyTag} is false the {@code tags} argument is ignored but must still be non-empty.
     */
    @Query(value = """
        select s from SecretEntity s
        where s.organizationId = :organizationId
          and s.environmentId = :environmentId
          and s.deletedAt is null
          and (:pathPrefix = '' or s.path = :pathPrefix or s.path like concat(:pathPattern, '%') escape '\\')
          and lower(s.key) like concat('%', :search, '%') escape '\\'
          and (:anyTag = false or exists (
                select 1 from SecretEntity t join t.tags tag
                where t.id = s.id and tag in :tags))
        """,
            countQuery = """
        select count(s) from SecretEntity s
        where s.organizationId = :organizationId
          and s.environmentId = :environmentId
          and s.deletedAt is null
          and (:pathPrefix = '' or s.path = :pathPrefix or s.path like concat(:pathPattern, '%') escape '\\')
          and lower(s.key) like concat('%', :search, '%') escape '\\'
          and (:anyTag = false or exists (
                select 1 from SecretEntity t join t.tags tag
                where t.id = s.id and tag in :tags))
        """)
    Page<SecretEntity> search(@Param("organizationId") UUID organizationId,
                              @Param("environmentId") UUID environmentId,
                              @Param("pathPrefix") String pathPrefix,
                              @Param("pathPattern") String pathPattern,
                              @Param("search") String search,
                              @Param("anyTag") boolean anyTag,
                              @Param("tags") Collection<String> tags,
                              Pageable pageable);

    @Query("""
        select s from SecretEntity s
        where s.organizationId = :organizationId
          and s.environmentId = :environmentId
          and s.keyHash = :keyHash
          and s.deletedAt is null
        order by s.path asc
        """)
    List<SecretEntity> findActiveByKeyHash(@Param("organizationId") UUID organizationId,
                                           @Param("environmentId") UUID environmentId,
                                           @Param("keyHash") String keyHash);

    @Query("""
        select s from SecretEntity s
        where s.organizationId = :organizationId
          and s.environmentId = :environmentId
          and s.deletedAt is null
          and (:pathPrefix = '' or s.path = :pathPrefix or s.path like concat(:pathPattern, '%') escape '\\')
        order by s.path asc, s.key asc
        """)
    List<SecretEntity> findActiveUnderPath(@Param("organizationId") UUID organizationId,
                                           @Param("environmentId") UUID environmentId,
                                           @Param("pathPrefix") String pathPrefix,
                                           @Param("pathPattern") String pathPattern);
}
