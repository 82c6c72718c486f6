package dustin.rental.domains.split.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.rental.domains.split.model.entity.SplitRule;

@Repository
public interface SplitRuleRepository extends JpaRepository<SplitRule, Long> {

    List<SplitRule> findByConfigurationIdOrderByIdAsc(Long configurationId);

    List<SplitRule> findByReceiverIdOrderByIdAsc(Long receiverId);

    Optional<SplitRule> findByIdAndConfigurationId(Long id, Long configurationId);
}
