package com.quantumskylink.orchestration.api.dto;

import com.quantumskylink.orchestration.service.ExecutionOutcome;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for a completed execute call.
 * {@code status} is the terminal status: SUCCESS or FAILED.
 */
public record ExecutionResponse(
        String              executionId,
        String              workflowId,
        String              status,
        String              failureKind,
        String              message,
        Map<String, Object> results,
        Instant             startedAt,
        Instant             completedAt
) {
    public static ExecutionResponse from(ExecutionOutcome outcome) {
        return new ExecutionResponse(
                outcome.executionId(),
                outcome.workflowId(),
                outcome.status().name(),
                outcome.failureKind() == null ? null : outcome.failureKind().name(),
                outcome.succeeded() ? "Workflow completed" : outcome.errorMessage(),
                outcome.results(),
                outcome.startedAt(),
                outcome.completedAt()
        );
    }
}
