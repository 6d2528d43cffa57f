package com.quantumskylink.orchestration.api;

import com.quantumskylink.orchestration.api.dto.ErrorResponse;
import com.quantumskylink.orchestration.service.ExecutionNotFoundException;
import com.quantumskylink.orchestration.service.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.List;

/**
 * Translates exceptions escaping the controllers into {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> invalidWorkflow(WorkflowValidationException e) {
        log.warn("Invalid workflow request for {}: {}", e.getWorkflowId(), e.getErrors());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ErrorResponse.INVALID_REQUEST, e.getMessage(), e.getErrors(), null, clock.instant()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ErrorResponse.INVALID_REQUEST, "Malformed request body",
                List.of("Request body is missing or is not valid JSON for this endpoint"), null, clock.instant()));
    }

    @ExceptionHandler(ExecutionNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(ExecutionNotFoundException e) {
        log.debug("Execution not found: {}", e.getExecutionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(
                ErrorResponse.NOT_FOUND, e.getMessage(), null, e.getExecutionId(), clock.instant()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> unexpected(RuntimeException e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                ErrorResponse.INTERNAL_ERROR, "An unexpected error occurred", null, null, clock.instant()));
    }
}
