package com.eventfacts.infrastructure.persistence.repository;

import com.eventfacts.domain.model.MetricKind;
import com.eventfacts.infrastructure.persistence.entity.MetricDefinitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface MetricDefinitionRepository extends JpaRepository<MetricDefinitionEntity, Long> {

    List<MetricDefinitionEntity> findByKindOrderBySortKeyAscIdAsc(MetricKind kind);

    @Query("SELECT MAX(d.updatedAt) FROM MetricDefinitionEntity d")
    Optional<Instant> findLatestUpdate();
}
