package com.eventfacts.infrastructure.persistence.repository;

import com.eventfacts.infrastructure.persistence.entity.MetricSampleEntity;
import com.eventfacts.infrastructure.persistence.entity.MetricSampleId;
import com.eventfacts.infrastructure.persistence.projection.MonthlyAggregate;
import com.eventfacts.infrastructure.persistence.projection.SampleRow;
import com.eventfacts.infrastructure.persistence.projection.YearlyAggregate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Sample reads backing the aggregation engine.
 *
 * Every query only looks at samples with a numeric value. Each query has a
 * "Labeled" twin restricting the category label; callers pick the twin only
 * for a non-empty label set, since an empty IN list is not portable.
 * Calendar grouping uses the database session time zone, which is pinned to UTC.
 */
@Repository
public interface MetricSampleRepository extends JpaRepository<MetricSampleEntity, MetricSampleId> {

    @Query("SELECT DISTINCT s.categoryLabel FROM MetricSampleEntity s " +
           "WHERE s.categoryLabel IS NOT NULL " +
           "ORDER BY s.categoryLabel")
    List<String> findDistinctCategoryLabels();

    @Query("SELECT new com.eventfacts.infrastructure.persistence.projection.SampleRow(s.numericValue, o.startDate) " +
           "FROM MetricSampleEntity s JOIN OccurrenceEntity o ON o.id = s.occurrenceId " +
           "WHERE s.metricId = :metricId AND s.numericValue IS NOT NULL " +
           "AND o.startDate BETWEEN :from AND :to " +
           "ORDER BY o.startDate ASC, o.id ASC")
    List<SampleRow> findNumericSamples(
            @Param("metricId") Long metricId,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    @Query("SELECT new com.eventfacts.infrastructure.persistence.projection.SampleRow(s.numericValue, o.startDate) " +
           "FROM MetricSampleEntity s JOIN OccurrenceEntity o ON o.id = s.occurrenceId " +
           "WHERE s.metricId = :metricId AND s.numericValue IS NOT NULL " +
           "AND o.startDate BETWEEN :from AND :to " +
           "AND s.categoryLabel IN :labels " +
           "ORDER BY o.startDate ASC, o.id ASC")
    List<SampleRow> findNumericSamplesLabeled(
            @Param("metricId") Long metricId,
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("labels") Collection<String> labels
    );

    @Query("SELECT new com.eventfacts.infrastructure.persistence.projection.MonthlyAggregate(" +
           "YEAR(o.startDate), MONTH(o.startDate), SUM(s.numericValue), COUNT(s.numericValue)) " +
           "FROM MetricSampleEntity s JOIN OccurrenceEntity o ON o.id = s.occurrenceId " +
           "WHERE s.metricId = :metricId AND s.numericValue IS NOT NULL " +
           "AND o.startDate BETWEEN :from AND :to " +
           "GROUP BY YEAR(o.startDate), MONTH(o.startDate) " +
           "ORDER BY YEAR(o.startDate), MONTH(o.startDate)")
    List<MonthlyAggregate> sumByMonth(
            @Param("metricId") Long metricId,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    @Query("SELECT new com.eventfacts.infrastructure.persistence.projection.MonthlyAggregate(" +
           "YEAR(o.startDate), MONTH(o.startDate), SUM(s.numericValue), COUNT(s.numericValue)) " +
           "FROM MetricSampleEntity s JOIN OccurrenceEntity o ON o.id = s.occurrenceId " +
           "WHERE s.metricId = :metricId AND s.numericValue IS NOT NULL " +
           "AND o.startDate BETWEEN :from AND :to " +
           "AND s.categoryLabel IN :labels " +
           "GROUP BY YEAR(o.startDate), MONTH(o.startDate) " +
           "ORDER BY YEAR(o.startDate), MONTH(o.startDate)")
    List<MonthlyAggregate> sumByMonthLabeled(
            @Param("metricId") Long metricId,
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("labels") Collection<String> labels
    );

    /**
     * Half-open range [from, until) so consecutive years never share a sample.
     */
    @Query("SELECT new com.eventfacts.infrastructure.persistence.projection.YearlyAggregate(" +
           "SUM(s.numericValue), AVG(s.numericValue), COUNT(s.numericValue)) " +
           "FROM MetricSampleEntity s JOIN OccurrenceEntity o ON o.id = s.occurrenceId " +
           "WHERE s.metricId = :metricId AND s.numericValue IS NOT NULL " +
           "AND o.startDate >= :from AND o.startDate < :until")
    YearlyAggregate aggregateYear(
            @Param("metricId") Long metricId,
            @Param("from") Instant from,
            @Param("until") Instant until
    );

    @Query("SELECT new com.eventfacts.infrastructure.persistence.projection.YearlyAggregate(" +
           "SUM(s.numericValue), AVG(s.numericValue), COUNT(s.numericValue)) " +
           "FROM MetricSampleEntity s JOIN OccurrenceEntity o ON o.id = s.occurrenceId " +
           "WHERE s.metricId = :metricId AND s.numericValue IS NOT NULL " +
           "AND o.startDate >= :from AND o.startDate < :until " +
           "AND s.categoryLabel IN :labels")
    YearlyAggregate aggregateYearLabeled(
            @Param("metricId") Long metricId,
            @Param("from") Instant from,
            @Param("until") Instant until,
            @Param("labels") Collection<String> labels
    );
}
