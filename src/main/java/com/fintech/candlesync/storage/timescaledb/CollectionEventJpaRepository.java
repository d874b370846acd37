package com.fintech.candlesync.storage.timescaledb;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for the data collection log.
 */
@Repository
public interface CollectionEventJpaRepository extends JpaRepository<CollectionEventEntity, Long> {
}
