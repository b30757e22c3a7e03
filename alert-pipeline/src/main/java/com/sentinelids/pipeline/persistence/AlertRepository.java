package com.sentinelids.pipeline.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for {@link AlertEntity}.
 *
 * @author Naveed Gung
 */
public interface AlertRepository extends JpaRepository<AlertEntity, Long> {

    Optional<AlertEntity> findBySourceMessageId(String sourceMessageId);

    List<AlertEntity> findAllByOrderByProcessedAtDesc(Pageable pageable);
}
