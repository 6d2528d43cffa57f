package com.quantumskylink.orchestration.api.dto;

import java.util.Map;

/**
 * Request body for POST /api/orchestration/workflows/{id}/execute.
 *
 * Required: inputs (as declared by the workflow)
 * Optional: triggeredBy, context, description, priority (1-10, default 5)
 */
public record ExecuteWorkflowRequest(
        Map<String, Object> inputs,
        String triggeredBy,
        Map<String, String> context,
        String description,
        Integer priority
) {
    public ExecuteWorkflowRequest {
        if (inputs == null) inputs = Map.of();
        if (triggeredBy == null || triggeredBy.isBlank()) triggeredBy = "api";
    }
}
