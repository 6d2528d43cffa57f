package com.quantumskylink.orchestration.api;

import com.quantumskylink.orchestration.api.dto.ErrorResponse;
import com.quantumskylink.orchestration.api.dto.ExecutionResponse;
import com.quantumskylink.orchestration.model.FailureKind;
import com.quantumskylink.orchestration.service.ExecutionOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.util.List;

/**
 * Maps a terminal execution outcome to an HTTP answer.
 *
 * HTTP 200 - SUCCESS, or FAILED because of a signature or business rejection
 * HTTP 400 - FAILED because the inputs could not be read as the workflow's request
 * HTTP 500 - FAILED because of an infrastructure fault or cancellation; opaque
 *            message plus the execution id for a later status lookup
 */
final class ExecutionResponses {

    static final String OPAQUE_FAILURE = "Workflow execution failed; query the execution status for details";

    private ExecutionResponses() {}

    static ResponseEntity<?> toResponse(ExecutionOutcome outcome, Clock clock) {
        FailureKind kind = outcome.failureKind();
        if (outcome.succeeded() || kind == FailureKind.AUTHORIZATION || kind == FailureKind.BUSINESS) {
            return ResponseEntity.ok(ExecutionResponse.from(outcome));
        }
        if (kind == FailureKind.VALIDATION) {
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    ErrorResponse.INVALID_REQUEST, outcome.errorMessage(),
                    List.of(outcome.errorMessage()), outcome.executionId(), clock.instant()));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                ErrorResponse.EXECUTION_FAILED, OPAQUE_FAILURE, null, outcome.executionId(), clock.instant()));
    }
}
