package com.eventfacts.api;

import com.eventfacts.domain.model.Annotation;
import com.eventfacts.domain.model.AnnotationRequest;
import com.eventfacts.domain.model.GrafanaQueryRequest;
import com.eventfacts.domain.model.MetricOption;
import com.eventfacts.domain.model.TimeSeriesResult;
import com.eventfacts.domain.service.GrafanaQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Grafana JSON datasource endpoints.
 *
 * Endpoints:
 * - GET  /             - datasource connection test
 * - POST /metrics      - selectable series with their filter payloads
 * - POST /query        - time series for a list of composite target keys
 * - POST /annotations  - occurrences in the dashboard range
 * - POST /tag-keys     - ad-hoc filter keys
 * - POST /tag-values   - ad-hoc filter values for a key
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GrafanaController {

    private final GrafanaQueryService grafanaQueryService;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "Event Facts Grafana JSON Datasource"));
    }

    @PostMapping("/metrics")
    public ResponseEntity<List<MetricOption>> metrics() {
        return ResponseEntity.ok(grafanaQueryService.listMetrics());
    }

    /**
     * Request body:
     * {
     *   "targets": [{ "target": "fact_5_monthly", "filter": ["Sunday Service"] }],
     *   "range": { "from": "2024-01-01T00:00:00Z", "to": "2024-12-31T23:59:59Z" }
     * }
     *
     * Response: [{ "target": "...", "datapoints": [[value, epochMillis], ...], "unit": "..." }]
     */
    @PostMapping("/query")
    public ResponseEntity<List<TimeSeriesResult>> query(@Valid @RequestBody GrafanaQueryRequest request) {
        log.debug("Query: {} targets, range={}", request.getTargets().size(), request.getRange());
        return ResponseEntity.ok(grafanaQueryService.query(request));
    }

    @PostMapping("/annotations")
    public ResponseEntity<List<Annotation>> annotations(@RequestBody(required = false) AnnotationRequest request) {
        return ResponseEntity.ok(grafanaQueryService.annotations(request));
    }

    @PostMapping("/tag-keys")
    public ResponseEntity<List<Map<String, String>>> tagKeys() {
        return ResponseEntity.ok(grafanaQueryService.tagKeys());
    }

    @PostMapping("/tag-values")
    public ResponseEntity<List<Map<String, String>>> tagValues(@RequestBody(required = false) Map<String, String> body) {
        String key = body != null ? body.get("key") : null;
        return ResponseEntity.ok(grafanaQueryService.tagValues(key));
    }
}
