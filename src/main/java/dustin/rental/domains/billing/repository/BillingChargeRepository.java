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

import dustin.rental.domains.billing.model.ChargeStatus;
import dustin.rental.domains.billing.model.entity.BillingCharge;
import dustin.rental.domains.split.model.ChargeType;
import jakarta.persistence.LockModeType;

/**
 * 청구 리포지토리
 * Billing Charge Repository
 */
@Repository
public interface BillingChargeRepository extends JpaRepository<BillingCharge, Long> {

    Optional<BillingCharge> findByToken(String token);

    Optional<BillingCharge> findByGatewayPaymentId(String gatewayPaymentId);

    List<BillingCharge> findByBillingCycleIdOrderByIdAsc(Long billingCycleId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM BillingCharge c WHERE c.id = :id")
    Optional<BillingCharge> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT c FROM BillingCharge c " +
           "WHERE (:agencyId IS NULL OR c.agencyId = :agencyId) " +
           "AND (:ownerId IS NULL OR c.ownerId = :ownerId) " +
           "AND (:contractId IS NULL OR c.contractId = :contractId) " +
           "AND (:tenantId IS NULL OR c.tenantId = :tenantId) " +
           "AND (:chargeType IS NULL OR c.chargeType = :chargeType) " +
           "AND (:status IS NULL OR c.status = :status) " +
           "AND (:billingMonth IS NULL OR c.billingMonth = :billingMonth)")
    Page<BillingCharge> search(@Param("agencyId") Long agencyId,
                               @Param("ownerId") Long ownerId,
                               @Param("contractId") Long contractId,
                               @Param("tenantId") Long tenantId,
                               @Param("chargeType") ChargeType chargeType,
                               @Param("status") ChargeStatus status,
                               @Param("billingMonth") String billingMonth,
                               Pageable pageable);
}
