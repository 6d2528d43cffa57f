package com.quantumskylink.orchestration.service;

import com.quantumskylink.orchestration.model.ExecutionStatus;
import com.quantumskylink.orchestration.model.FailureKind;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;

import java.time.Instant;
import java.util.Map;

/** Terminal result of {@link WorkflowExecutor#execute}. */
public record ExecutionOutcome(
        String executionId,
        String workflowId,
        ExecutionStatus status,
        FailureKind failureKind,
        String errorMessage,
        Map<String, Object> results,
        Instant startedAt,
        Instant completedAt
) {
    public static ExecutionOutcome from(WorkflowExecutionContext ctx) {
        return new ExecutionOutcome(
                ctx.getExecutionId(),
                ctx.getWorkflowId(),
                ctx.getStatus(),
                ctx.getFailureKind(),
                ctx.getErrorMessage(),
                ctx.getResults(),
                ctx.getStartedAt(),
                ctx.getCompletedAt());
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}
