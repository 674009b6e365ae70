package com.eventfacts.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPayload {

    private String name;
    private String label;
    private String type;
    private String placeholder;
    private List<PayloadOption> options;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PayloadOption {
        private String label;
        private String value;
    }
}
