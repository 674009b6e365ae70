package com.eventfacts.infrastructure.upstream;

import com.eventfacts.domain.exception.UpstreamAuthenticationException;
import com.eventfacts.domain.exception.UpstreamFetchException;
import com.eventfacts.domain.model.DateRange;
import com.eventfacts.domain.model.MetricDefinition;
import com.eventfacts.domain.model.MetricSample;
import com.eventfacts.domain.model.Occurrence;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * RestTemplate based upstream client.
 *
 * Login is a cookie session: POST /login, verified by GET /whoami. The cookie
 * store lives in the HTTP client backing this instance's RestTemplate.
 */
@Slf4j
public class RestUpstreamClient implements UpstreamClient {

    private final RestTemplate restTemplate;
    private final UpstreamRecordMapper mapper;
    private final String username;
    private final String password;

    private volatile boolean authenticated;

    public RestUpstreamClient(RestTemplate restTemplate, UpstreamRecordMapper mapper,
                              String username, String password) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.username = username;
        this.password = password;
    }

    @Override
    public synchronized void authenticate() {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            restTemplate.postForEntity("/login",
                    new HttpEntity<>(Map.of("username", username, "password", password), headers),
                    JsonNode.class);
            restTemplate.getForObject("/whoami", JsonNode.class);
            authenticated = true;
            log.info("Successfully authenticated with upstream as {}", username);
        } catch (RestClientException e) {
            authenticated = false;
            throw new UpstreamAuthenticationException("Authentication failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAuthenticated() {
        return authenticated;
    }

    @Override
    public List<MetricDefinition> fetchMetricDefinitions() {
        JsonNode masterData = get("master data", "/event/masterdata");
        return mapper.toMetricDefinitions(masterData == null ? null : masterData.get("facts"));
    }

    @Override
    public List<Occurrence> fetchOccurrences(DateRange range) {
        JsonNode events = get("events " + range, "/events?from={from}&to={to}", range.from(), range.to());
        return mapper.toOccurrences(events);
    }

    @Override
    public List<MetricSample> fetchSamples(long occurrenceId) {
        JsonNode facts = get("facts for event " + occurrenceId, "/events/{id}/facts", occurrenceId);
        return mapper.toSamples(facts, occurrenceId);
    }

    private JsonNode get(String what, String path, Object... uriVariables) {
        ensureAuthenticated();
        try {
            return unwrap(restTemplate.getForObject(path, JsonNode.class, uriVariables));
        } catch (RestClientException e) {
            throw new UpstreamFetchException("Error fetching " + what + ": " + e.getMessage(), e);
        }
    }

    private void ensureAuthenticated() {
        if (!authenticated) {
            authenticate();
        }
    }

    /**
     * Upstream responses are either bare or wrapped as {"data": ...}.
     */
    static JsonNode unwrap(JsonNode response) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            return null;
        }
        if (response.isObject() && response.has("data")) {
            return response.get("data");
        }
        return response;
    }
}
