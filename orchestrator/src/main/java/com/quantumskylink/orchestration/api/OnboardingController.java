package com.quantumskylink.orchestration.api;

import com.quantumskylink.orchestration.api.dto.ErrorResponse;
import com.quantumskylink.orchestration.api.dto.OnboardingRunRequest;
import com.quantumskylink.orchestration.api.dto.WorkflowStatusResponse;
import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
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
import java.util.Map;

/**
 * Convenience endpoints over the onboarding workflow.
 *
 * POST /api/orchestration/onboarding/run          - body {"userId": "..."}
 * GET  /api/orchestration/onboarding/status/{id}  - id is a user id or an execution id
 */
@RestController
@RequestMapping("/api/orchestration/onboarding")
public class OnboardingController {

    private static final Logger log = LoggerFactory.getLogger(OnboardingController.class);

    static final String TRIGGERED_BY = "OrchestrationService";

    private final WorkflowExecutor      executor;
    private final WorkflowStatusService statusService;
    private final Clock                 clock;

    public OnboardingController(WorkflowExecutor executor, WorkflowStatusService statusService, Clock clock) {
        this.executor      = executor;
        this.statusService = statusService;
        this.clock         = clock;
    }

    @PostMapping("/run")
    public ResponseEntity<?> run(@RequestBody(required = false) OnboardingRunRequest req) {
        if (req == null || req.userId() == null || req.userId().isBlank()) {
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    ErrorResponse.INVALID_REQUEST, "userId is required in body",
                    List.of("userId is required in body"), null, clock.instant()));
        }
        log.info("Starting onboarding for user {}", req.userId());
        Map<String, Object> inputs = Map.of("userRegistration", Map.of("userId", req.userId()));
        ExecutionOutcome outcome = executor.execute(new ExecutionRequest(
                WorkflowCatalogConfiguration.ONBOARDING, inputs, TRIGGERED_BY, null,
                "Onboarding run for user " + req.userId(), null));
        return ExecutionResponses.toResponse(outcome, clock);
    }

    /** Returns 404 when neither the user index nor the execution store knows {@code id}. */
    @GetMapping("/status/{id}")
    public WorkflowStatusResponse status(@PathVariable String id) {
        return WorkflowStatusResponse.from(statusService.describeOnboarding(id));
    }
}
