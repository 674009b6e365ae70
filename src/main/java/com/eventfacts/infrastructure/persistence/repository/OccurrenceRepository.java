package com.eventfacts.infrastructure.persistence.repository;

import com.eventfacts.infrastructure.persistence.entity.OccurrenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OccurrenceRepository extends JpaRepository<OccurrenceEntity, Long> {

    /**
     * Sync watermark: the latest time any occurrence was written.
     */
    @Query("SELECT MAX(o.createdAt) FROM OccurrenceEntity o")
    Optional<Instant> findWatermark();

    List<OccurrenceEntity> findByStartDateBetweenOrderByStartDateAscIdAsc(Instant from, Instant to);
}
