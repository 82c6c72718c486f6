package dustin.rental.domains.audit.repository;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import dustin.rental.domains.audit.model.entity.SplitAuditLog;

/**
 * 감사 로그 리포지토리
 * Split Audit Log Repository
 *
 * 조회 전용 쿼리만 정의한다.
 */
@Repository
public interface SplitAuditLogRepository extends JpaRepository<SplitAuditLog, Long> {

    Page<SplitAuditLog> findByConfigurationIdOrderByPerformedAtDescIdDesc(Long configurationId, Pageable pageable);

    List<SplitAuditLog> findByConfigurationIdOrderByIdAsc(Long configurationId);

    List<SplitAuditLog> findByEntityTypeAndEntityIdOrderByIdAsc(AuditEntityType entityType, Long entityId);

    long countByConfigurationIdAndAction(Long configurationId, AuditAction action);
}
