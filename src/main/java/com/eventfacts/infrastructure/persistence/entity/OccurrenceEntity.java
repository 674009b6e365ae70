package com.eventfacts.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Upstream event that samples hang off.
 *
 * createdAt is rewritten on every upsert; its maximum is the sync watermark.
 */
@Entity
@Table(name = "occurrences", indexes = {
    @Index(name = "idx_occurrences_start_date", columnList = "startDate"),
    @Index(name = "idx_occurrences_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OccurrenceEntity {

    @Id
    private Long id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(nullable = false)
    private Instant startDate;

    @Column
    private Instant endDate;

    @Column
    private Long calendarId;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
