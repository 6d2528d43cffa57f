package com.quantumskylink.orchestration.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every non-2xx answer.
 *
 * {@code error} tells client-causable failures ("InvalidRequest") apart from
 * missing executions ("ExecutionNotFound") and opaque server failures
 * ("WorkflowExecutionFailed", "InternalError").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String       error,
        String       message,
        List<String> details,
        String       executionId,
        Instant      timestamp
) {
    public static final String INVALID_REQUEST    = "InvalidRequest";
    public static final String NOT_FOUND          = "ExecutionNotFound";
    public static final String EXECUTION_FAILED   = "WorkflowExecutionFailed";
    public static final String INTERNAL_ERROR     = "InternalError";
}
