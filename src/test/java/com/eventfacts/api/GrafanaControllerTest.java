package com.eventfacts.api;

import com.eventfacts.domain.model.SeriesPoint;
import com.eventfacts.domain.model.TimeSeriesResult;
import com.eventfacts.domain.service.GrafanaQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GrafanaController.class)
class GrafanaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GrafanaQueryService grafanaQueryService;

    @Test
    void testRoot_AnswersConnectionTest() throws Exception {
        // When / Then
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void testQuery_DatapointsAsValueTimestampPairs() throws Exception {
        // Given
        when(grafanaQueryService.query(any())).thenReturn(List.of(TimeSeriesResult.builder()
                .target("Attendance - Monthly Sum (people)")
                .datapoints(List.of(new SeriesPoint(10.0, 1704067200000L)))
                .unit("people")
                .build()));

        // When / Then
        mockMvc.perform(post("/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targets": [{"target": "fact_5_monthly", "refId": "A"}],
                                 "range": {"from": "2024-01-01T00:00:00Z", "to": "2024-12-31T23:59:59Z"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].target").value("Attendance - Monthly Sum (people)"))
                .andExpect(jsonPath("$[0].datapoints[0][0]").value(10.0))
                .andExpect(jsonPath("$[0].datapoints[0][1]").value(1704067200000L))
                .andExpect(jsonPath("$[0].unit").value("people"));
    }

    @Test
    void testQuery_MissingRangeIsBadRequest() throws Exception {
        // When / Then
        mockMvc.perform(post("/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targets\": [{\"target\": \"fact_5_raw\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(grafanaQueryService);
    }

    @Test
    void testQuery_UnparsableTimestampIsBadRequest() throws Exception {
        // Given
        when(grafanaQueryService.query(any())).thenThrow(new IllegalArgumentException("range.from is not an ISO-8601 timestamp"));

        // When / Then
        mockMvc.perform(post("/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"range\": {\"from\": \"soon\", \"to\": \"later\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("range.from is not an ISO-8601 timestamp"));
    }

    @Test
    void testTagValues_KeyFromBody() throws Exception {
        // Given
        when(grafanaQueryService.tagValues("category")).thenReturn(List.of(Map.of("text", "X")));

        // When / Then
        mockMvc.perform(post("/tag-values")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\": \"category\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].text").value("X"));
    }

    @Test
    void testMetrics_EmptyBody() throws Exception {
        // Given
        when(grafanaQueryService.listMetrics()).thenReturn(List.of());

        // When / Then
        mockMvc.perform(post("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
