package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Response of every analytics endpoint.
 * {@code success=false} is a business rejection of the stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyticsStageResult(
        boolean success,
        String message,
        String reportId,
        long dataPoints,
        Map<String, Object> data
) {
    public AnalyticsStageResult {
        data = data == null ? Map.of() : data;
    }
}
