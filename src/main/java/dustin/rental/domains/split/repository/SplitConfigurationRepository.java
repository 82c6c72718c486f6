package dustin.rental.domains.split.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.rental.domains.split.model.ConfigurationScope;
import dustin.rental.domains.split.model.ConfigurationStatus;
import dustin.rental.domains.split.model.entity.SplitConfiguration;
import jakarta.persistence.LockModeType;

/**
 * 분할 설정 리포지토리
 * Split Configuration Repository
 */
@Repository
public interface SplitConfigurationRepository extends JpaRepository<SplitConfiguration, Long> {

    Optional<SplitConfiguration> findByToken(String token);

    /**
     * 활성 설정 조회 (active_scope_key 유니크)
     */
    Optional<SplitConfiguration> findByActiveScopeKey(String activeScopeKey);

    /**
     * 비관적 락으로 설정 조회 (수정/상태 전이 직렬화)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM SplitConfiguration c WHERE c.id = :id")
    Optional<SplitConfiguration> findByIdForUpdate(@Param("id") Long id);

    /**
     * 같은 범위의 다른 설정 중 지정 상태인 것을 비관적 락으로 조회 (활성화 시 기존 ACTIVE 강등)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM SplitConfiguration c " +
           "WHERE c.scopeKey = :scopeKey AND c.status = :status AND c.id <> :excludeId " +
           "ORDER BY c.id ASC")
    List<SplitConfiguration> findSiblingsForUpdate(@Param("scopeKey") String scopeKey,
                                                   @Param("status") ConfigurationStatus status,
                                                   @Param("excludeId") Long excludeId);

    @Query("SELECT MAX(c.version) FROM SplitConfiguration c WHERE c.scopeKey = :scopeKey AND c.name = :name")
    Integer findMaxVersion(@Param("scopeKey") String scopeKey, @Param("name") String name);

    @Query("SELECT c FROM SplitConfiguration c " +
           "WHERE (:agencyId IS NULL OR c.agencyId = :agencyId) " +
           "AND (:ownerId IS NULL OR c.ownerId = :ownerId) " +
           "AND (:scope IS NULL OR c.scope = :scope) " +
           "AND (:status IS NULL OR c.status = :status)")
    Page<SplitConfiguration> search(@Param("agencyId") Long agencyId,
                                    @Param("ownerId") Long ownerId,
                                    @Param("scope") ConfigurationScope scope,
                                    @Param("status") ConfigurationStatus status,
                                    Pageable pageable);

    List<SplitConfiguration> findByPreviousVersionId(Long previousVersionId);
}
