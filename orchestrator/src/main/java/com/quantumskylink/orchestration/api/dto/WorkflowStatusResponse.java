package com.quantumskylink.orchestration.api.dto;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.service.ExecutionStatusReport;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for GET /executions/{id}/status and GET /onboarding/status/{id}.
 */
public record WorkflowStatusResponse(
        String                  executionId,
        String                  workflowId,
        String                  status,
        String                  currentStep,
        int                     progress,
        Instant                 estimatedCompletion,
        Instant                 startedAt,
        Instant                 completedAt,
        long                    durationMs,
        String                  triggeredBy,
        List<HighlightResponse> highlights,
        Map<String, Object>     results,
        String                  errorMessage,
        String                  failureKind
) {
    public static WorkflowStatusResponse from(ExecutionStatusReport report) {
        WorkflowExecutionContext ctx = report.context();
        return new WorkflowStatusResponse(
                ctx.getExecutionId(),
                ctx.getWorkflowId(),
                ctx.getStatus().name(),
                report.currentStep(),
                report.progress(),
                report.estimatedCompletion(),
                ctx.getStartedAt(),
                ctx.getCompletedAt(),
                report.duration().toMillis(),
                ctx.getTriggeredBy(),
                ctx.getHighlights().stream().map(HighlightResponse::from).toList(),
                ctx.getResults(),
                ctx.getErrorMessage(),
                ctx.getFailureKind() == null ? null : ctx.getFailureKind().name()
        );
    }
}
