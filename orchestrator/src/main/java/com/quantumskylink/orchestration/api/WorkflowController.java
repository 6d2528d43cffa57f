package com.quantumskylink.orchestration.api;

import com.quantumskylink.orchestration.api.dto.ExecuteWorkflowRequest;
import com.quantumskylink.orchestration.api.dto.ValidateWorkflowRequest;
import com.quantumskylink.orchestration.api.dto.ValidationResponse;
import com.quantumskylink.orchestration.api.dto.WorkflowDefinitionResponse;
import com.quantumskylink.orchestration.api.dto.WorkflowStatusResponse;
import com.quantumskylink.orchestration.catalog.WorkflowCatalog;
import com.quantumskylink.orchestration.service.ExecutionOutcome;
import com.quantumskylink.orchestration.service.ExecutionRequest;
import com.quantumskylink.orchestration.service.WorkflowExecutor;
import com.quantumskylink.orchestration.service.WorkflowStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

/**
 * REST API for workflow execution and inspection.
 *
 * POST /api/orchestration/workflows/{id}/execute    - run a workflow to completion
 * GET  /api/orchestration/executions/{id}/status    - execution state and step highlights
 * GET  /api/orchestration/executions/{id}/progress  - 0..100
 * GET  /api/orchestration/workflows                 - active workflow definitions
 * POST /api/orchestration/workflows/{id}/validate   - check inputs without executing
 */
@RestController
@RequestMapping("/api/orchestration")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowExecutor      executor;
    private final WorkflowStatusService statusService;
    private final WorkflowCatalog       catalog;
    private final Clock                 clock;

    public WorkflowController(WorkflowExecutor executor,
                              WorkflowStatusService statusService,
                              WorkflowCatalog catalog,
                              Clock clock) {
        this.executor      = executor;
        this.statusService = statusService;
        this.catalog       = catalog;
        this.clock         = clock;
    }

    /**
     * Execute a workflow synchronously.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/orchestration/workflows/payment-processing-zero-trust/execute \
     *     -H "Content-Type: application/json" \
     *     -d '{"inputs":{"paymentRequest":{...}},"triggeredBy":"wallet-app"}'
     */
    @PostMapping("/workflows/{workflowId}/execute")
    public ResponseEntity<?> execute(@PathVariable String workflowId,
                                     @RequestBody ExecuteWorkflowRequest req) {
        log.info("Executing workflow: {}, triggeredBy: {}", workflowId, req.triggeredBy());
        ExecutionOutcome outcome = executor.execute(new ExecutionRequest(
                workflowId, req.inputs(), req.triggeredBy(), req.context(), req.description(), req.priority()));
        return ExecutionResponses.toResponse(outcome, clock);
    }

    /** Returns 404 for unknown or expired execution ids. */
    @GetMapping("/executions/{executionId}/status")
    public WorkflowStatusResponse status(@PathVariable String executionId) {
        return WorkflowStatusResponse.from(statusService.describe(executionId));
    }

    /** Returns 404 for unknown or expired execution ids. */
    @GetMapping("/executions/{executionId}/progress")
    public int progress(@PathVariable String executionId) {
        return statusService.getProgress(executionId);
    }

    @GetMapping("/workflows")
    public List<WorkflowDefinitionResponse> workflows() {
        return catalog.listActive().stream()
                .map(WorkflowDefinitionResponse::from)
                .toList();
    }

    /** Pure check; never creates an execution. Unknown ids answer 200 with valid=false. */
    @PostMapping("/workflows/{workflowId}/validate")
    public ValidationResponse validate(@PathVariable String workflowId,
                                       @RequestBody(required = false) ValidateWorkflowRequest req) {
        ValidateWorkflowRequest body = req == null ? new ValidateWorkflowRequest(null) : req;
        return ValidationResponse.from(executor.validate(workflowId, body.inputs()));
    }
}
