package com.quantumskylink.orchestration.api.dto;

import java.util.Map;

/** Request body for POST /api/orchestration/workflows/{id}/validate. */
public record ValidateWorkflowRequest(Map<String, Object> inputs) {

    public ValidateWorkflowRequest {
        if (inputs == null) inputs = Map.of();
    }
}
