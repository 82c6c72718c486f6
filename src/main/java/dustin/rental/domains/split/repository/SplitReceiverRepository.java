package dustin.rental.domains.split.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.rental.domains.split.model.entity.SplitReceiver;

@Repository
public interface SplitReceiverRepository extends JpaRepository<SplitReceiver, Long> {

    List<SplitReceiver> findByConfigurationIdOrderByIdAsc(Long configurationId);

    Optional<SplitReceiver> findByIdAndConfigurationId(Long id, Long configurationId);
}
