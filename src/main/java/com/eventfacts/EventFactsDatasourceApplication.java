package com.eventfacts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Event Facts Grafana Datasource
 *
 * Mirrors metric definitions, events and their recorded facts from an upstream
 * event-management system into PostgreSQL and serves them to Grafana.
 *
 * Architecture:
 * - Sync orchestrator: hourly window sync, startup sync, on-demand triggers
 * - Batched, concurrent sample ingestion; paced year backfills
 * - Aggregation engine: raw, monthly, yearly sum, yearly mean
 * - Grafana JSON datasource endpoints with category filtering
 * - Redis caching for computed series, keyed by the sync watermark
 */
@SpringBootApplication
@EnableScheduling
public class EventFactsDatasourceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventFactsDatasourceApplication.class, args);
    }
}
