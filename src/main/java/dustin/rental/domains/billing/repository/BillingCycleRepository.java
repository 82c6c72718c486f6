package dustin.rental.domains.billing.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.rental.domains.billing.model.BillingCycleStatus;
import dustin.rental.domains.billing.model.entity.BillingCycle;
import jakarta.persistence.LockModeType;

/**
 * 청구 주기 리포지토리
 * Billing Cycle Repository
 */
@Repository
public interface BillingCycleRepository extends JpaRepository<BillingCycle, Long> {

    Optional<BillingCycle> findByScopeKeyAndBillingMonth(String scopeKey, String billingMonth);

    /**
     * 주기 id 만 조회 (엔티티를 영속성 컨텍스트에 올리지 않음)
     */
    @Query("SELECT c.id FROM BillingCycle c WHERE c.scopeKey = :scopeKey AND c.billingMonth = :billingMonth")
    Optional<Long> findIdByScopeKeyAndBillingMonth(@Param("scopeKey") String scopeKey,
                                                   @Param("billingMonth") String billingMonth);

    Page<BillingCycle> findByScopeKeyOrderByBillingMonthDesc(String scopeKey, Pageable pageable);

    /**
     * 마감 직렬화용 비관적 락 조회
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM BillingCycle c WHERE c.id = :id")
    Optional<BillingCycle> findByIdForUpdate(@Param("id") Long id);

    /**
     * 지정 월 이전의 미마감 주기 (YYYY-MM 문자열 비교)
     */
    @Query("SELECT c.id FROM BillingCycle c WHERE c.status = :status AND c.billingMonth < :billingMonth " +
           "ORDER BY c.billingMonth ASC, c.id ASC")
    List<Long> findIdsByStatusAndBillingMonthBefore(@Param("status") BillingCycleStatus status,
                                                    @Param("billingMonth") String billingMonth);
}
