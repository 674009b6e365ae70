package com.eventfacts.infrastructure.persistence.entity;

import com.eventfacts.domain.model.MetricKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Metric definition mirrored from the upstream master data.
 *
 * The id is assigned upstream and stable across syncs, so a save() with the
 * same id replaces the row.
 */
@Entity
@Table(name = "metric_definitions", indexes = {
    @Index(name = "idx_metric_definitions_kind_sort", columnList = "kind,sortKey")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricDefinitionEntity {

    @Id
    private Long id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String translatedName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MetricKind kind;

    @Column(columnDefinition = "TEXT")
    private String unit;

    @Column(nullable = false)
    private int sortKey;

    @Column(nullable = false)
    private Instant updatedAt;

    /**
     * Name shown to dashboard users.
     */
    public String getDisplayName() {
        return translatedName != null && !translatedName.isBlank() ? translatedName : name;
    }
}
