package com.eventfacts.api;

import com.eventfacts.domain.model.SyncResult;
import com.eventfacts.domain.service.SyncService;
import com.eventfacts.infrastructure.persistence.MetricStore;
import com.eventfacts.infrastructure.upstream.UpstreamClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sync status and on-demand triggers.
 *
 * Endpoints:
 * - GET  /health             - single-flight state and last sync watermark
 * - POST /sync               - window sync (previous, current, next month)
 * - POST /sync/years/{year}  - full year backfill
 *
 * A trigger while a pass is running answers 409, a failed pass 500
 * (see RestErrorHandler).
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SyncController {

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2999;

    private final SyncService syncService;
    private final MetricStore metricStore;
    private final UpstreamClient upstreamClient;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Instant lastSync = metricStore.findWatermark().orElse(null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("authenticated", upstreamClient.isAuthenticated());
        body.put("syncRunning", syncService.isRunning());
        body.put("lastSync", lastSync != null ? lastSync.toString() : null);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync() {
        log.info("On-demand window sync requested");
        return ResponseEntity.ok(success("Sync completed", syncService.syncWindow()));
    }

    @PostMapping("/sync/years/{year}")
    public ResponseEntity<Map<String, Object>> backfill(@PathVariable int year) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
        log.info("On-demand backfill requested for {}", year);
        return ResponseEntity.ok(success("Year " + year + " sync completed", syncService.backfillYear(year)));
    }

    private static Map<String, Object> success(String message, SyncResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("message", message);
        body.put("occurrences", result.getOccurrences());
        body.put("samples", result.getSamples());
        body.put("completedAt", result.getCompletedAt() != null ? result.getCompletedAt().toString() : null);
        return body;
    }
}
