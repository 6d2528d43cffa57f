package com.quantumskylink.orchestration.service;

import com.quantumskylink.orchestration.catalog.WorkflowCatalog;
import com.quantumskylink.orchestration.event.WorkflowEventPublisher;
import com.quantumskylink.orchestration.model.FailureKind;
import com.quantumskylink.orchestration.model.ValidationResult;
import com.quantumskylink.orchestration.model.WorkflowDefinition;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.PipelineRegistry;
import com.quantumskylink.orchestration.pipeline.PipelineRunner;
import com.quantumskylink.orchestration.pipeline.StepResult;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import com.quantumskylink.orchestration.repository.ExecutionContextStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for running a workflow.
 *
 * <pre>
 *   validate → create context (RUNNING) → index → workflow_started
 *     → pipeline run → SUCCESS | FAILED → completion / failure events
 * </pre>
 *
 * Validation failures throw {@link WorkflowValidationException} before any
 * context exists or any collaborator is called. Once a context exists this
 * class is the only place that makes it terminal, and it always does so
 * before returning. The call is synchronous: the returned outcome carries
 * the terminal status.
 *
 * Metrics:
 * <pre>
 *   skylink.workflow.executions{workflow, status="success|failed"}
 *   skylink.workflow.duration{workflow, status}
 * </pre>
 */
@Service
public class WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    static final String MDC_EXECUTION_ID = "executionId";
    static final String MDC_WORKFLOW_ID  = "workflowId";

    /** Reported as the failed step when a run fails before its first step. */
    static final String INPUT_BINDING_STEP = "Input Binding";

    private final WorkflowCatalog        catalog;
    private final PipelineRegistry       pipelines;
    private final PipelineRunner         runner;
    private final ExecutionContextStore  store;
    private final WorkflowEventPublisher events;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;
    private final Duration               ttl;

    public WorkflowExecutor(WorkflowCatalog catalog,
                            PipelineRegistry pipelines,
                            PipelineRunner runner,
                            ExecutionContextStore store,
                            WorkflowEventPublisher events,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            @Value("${skylink.execution.ttl:24h}") Duration ttl) {
        this.catalog       = catalog;
        this.pipelines     = pipelines;
        this.runner        = runner;
        this.store         = store;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.ttl           = ttl;

        List<String> missing = catalog.ids().stream()
                .filter(id -> pipelines.find(id).isEmpty())
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No pipeline registered for workflows: " + missing);
        }
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Pure check of an input bag: declared inputs first, then the fields of
     * the workflow's request. Creates nothing.
     */
    public ValidationResult validate(String workflowId, Map<String, Object> inputs) {
        Map<String, Object> bag = inputs == null ? Map.of() : inputs;
        ValidationResult declared = catalog.validate(workflowId, bag);
        if (!declared.valid()) {
            return declared;
        }
        List<String> requestErrors = pipelines.find(workflowId)
                .map(pipeline -> pipeline.validateRequest(bag))
                .orElse(List.of());
        return declared.withErrors(requestErrors);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Run a workflow to a terminal status.
     *
     * @throws WorkflowValidationException for an unknown or inactive workflow
     *                                     or invalid inputs; nothing is created
     */
    public ExecutionOutcome execute(ExecutionRequest request) {
        String workflowId = request.workflowId();
        WorkflowDefinition definition = catalog.get(workflowId)
                .orElseThrow(() -> new WorkflowValidationException(workflowId,
                        List.of("Workflow not found: " + workflowId)));
        if (!definition.active()) {
            throw new WorkflowValidationException(workflowId, List.of("Workflow is not active: " + workflowId));
        }
        ValidationResult validation = validate(workflowId, request.inputs());
        if (!validation.valid()) {
            log.warn("Rejected execution of {}: {}", workflowId, validation.errors());
            throw new WorkflowValidationException(workflowId, validation.errors());
        }
        WorkflowPipeline pipeline = pipelines.find(workflowId)
                .orElseThrow(() -> new IllegalStateException("No pipeline for " + workflowId));

        String executionId = UUID.randomUUID().toString();
        WorkflowExecutionContext ctx = new WorkflowExecutionContext(
                executionId, workflowId, request.inputs(), metadataOf(request),
                request.triggeredBy(), clock.instant());

        MDC.put(MDC_EXECUTION_ID, executionId);
        MDC.put(MDC_WORKFLOW_ID, workflowId);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            log.info("Starting workflow {} (execution {}, triggeredBy={})",
                    workflowId, executionId, request.triggeredBy());
            store.put(executionId, ctx, ttl);
            pipeline.secondaryKey(request.inputs())
                    .ifPresent(key -> store.putIndex(key, executionId, ttl));
            notify(() -> events.publish(workflowId, executionId, "workflow_started", startedData(request)));

            StepResult result;
            try {
                result = runner.run(pipeline, ctx);
            } catch (RuntimeException e) {
                log.error("Pipeline {} crashed for execution {}", workflowId, executionId, e);
                result = StepResult.failure(FailureKind.INFRASTRUCTURE,
                        "Unexpected orchestration error: " + e.getMessage());
            }
            finish(pipeline, ctx, result);
            return ExecutionOutcome.from(ctx);
        } finally {
            String status = ctx.getStatus().name().toLowerCase();
            sample.stop(meterRegistry.timer("skylink.workflow.duration",
                    "workflow", workflowId, "status", status));
            meterRegistry.counter("skylink.workflow.executions",
                    "workflow", workflowId, "status", status).increment();
            MDC.remove(MDC_EXECUTION_ID);
            MDC.remove(MDC_WORKFLOW_ID);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void finish(WorkflowPipeline pipeline, WorkflowExecutionContext ctx, StepResult result) {
        String workflowId  = ctx.getWorkflowId();
        String executionId = ctx.getExecutionId();
        Instant now = clock.instant();

        if (result instanceof StepResult.Failure failure) {
            String failedStep = ctx.getCurrentStep() != null ? ctx.getCurrentStep() : INPUT_BINDING_STEP;
            ctx.markFailed(failure.kind(), failure.message(), now);
            store.put(executionId, ctx, ttl);
            log.error("Workflow {} failed at step '{}' ({}): {}",
                    workflowId, failedStep, failure.kind(), failure.message());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("failureKind", failure.kind().name());
            data.put("failedStep", failedStep);
            data.put("error", WorkflowEventPublisher.redact(failure.message()));
            notify(() -> events.publish(workflowId, executionId, "workflow_failed", data));
            notify(() -> events.publishError(workflowId, executionId, failure.kind(), failure.message()));
            if (failure.kind() == FailureKind.INFRASTRUCTURE) {
                notify(() -> events.publishAdminAlert("workflow_infrastructure_failure",
                        failure.message(), workflowId, executionId));
            }
            return;
        }

        ctx.mergeResults(((StepResult.Success) result).results());
        ctx.markSucceeded(now);
        store.put(executionId, ctx, ttl);
        Duration elapsed = Duration.between(ctx.getStartedAt(), now);
        log.info("Workflow {} completed in {} ms", workflowId, elapsed.toMillis());

        notify(() -> events.publishCompletion(workflowId, executionId, elapsed, ctx.getResults()));
        pipeline.completionEvent(ctx).ifPresent(event ->
                notify(() -> events.publish(workflowId, executionId, event.eventType(), event.data())));
    }

    /** Event delivery is best-effort; a publisher fault never reaches the caller. */
    private void notify(Runnable publish) {
        try {
            publish.run();
        } catch (RuntimeException e) {
            log.warn("Event publication failed: {}", e.getMessage(), e);
        }
    }

    private static Map<String, String> metadataOf(ExecutionRequest request) {
        Map<String, String> metadata = new LinkedHashMap<>(request.context());
        if (request.description() != null) {
            metadata.put("description", request.description());
        }
        metadata.put("priority", String.valueOf(request.priority()));
        return metadata;
    }

    private static Map<String, Object> startedData(ExecutionRequest request) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("triggeredBy", request.triggeredBy());
        data.put("description", request.description());
        data.put("priority", request.priority());
        return data;
    }
}
