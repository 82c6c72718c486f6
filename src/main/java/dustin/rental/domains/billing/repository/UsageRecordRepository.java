package dustin.rental.domains.billing.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.rental.domains.billing.model.UsageFeature;
import dustin.rental.domains.billing.model.entity.UsageRecord;

/**
 * 사용량 기록 리포지토리
 * Usage Record Repository
 */
@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, Long> {

    @Query("SELECT COALESCE(SUM(u.quantity), 0) FROM UsageRecord u " +
           "WHERE u.scopeKey = :scopeKey AND u.billingMonth = :billingMonth AND u.feature = :feature")
    Long sumQuantity(@Param("scopeKey") String scopeKey,
                     @Param("billingMonth") String billingMonth,
                     @Param("feature") UsageFeature feature);
}
