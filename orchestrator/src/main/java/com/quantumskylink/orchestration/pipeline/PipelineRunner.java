package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.client.DownstreamException;
import com.quantumskylink.orchestration.event.WorkflowEventPublisher;
import com.quantumskylink.orchestration.model.FailureKind;
import com.quantumskylink.orchestration.model.HighlightStatus;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.repository.ExecutionContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Drives one execution through its pipeline's steps.
 *
 * Steps run strictly in order on the calling thread. After every step the
 * context is written back to the store, so status readers see each step as
 * soon as it finishes, and a status update is published. The runner never
 * marks the context terminal; it returns the overall {@link StepResult}
 * and leaves that to the executor.
 *
 * <p>Failure rules:
 * <ul>
 *   <li>A fatal step's failure stops the run and is returned as-is.</li>
 *   <li>A best-effort step's failure is logged, its highlight is marked
 *       SKIPPED, and the run continues. Cancellation is never skipped.</li>
 *   <li>Exceptions escaping a step are classified here and nowhere else.</li>
 *   <li>An interrupted thread stops the run before the next step with
 *       {@code CANCELLED}. Steps already applied downstream are not undone.</li>
 * </ul>
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final ExecutionContextStore  store;
    private final WorkflowEventPublisher events;
    private final Clock                  clock;
    private final Duration               ttl;

    public PipelineRunner(ExecutionContextStore store,
                          WorkflowEventPublisher events,
                          Clock clock,
                          @Value("${skylink.execution.ttl:24h}") Duration ttl) {
        this.store  = store;
        this.events = events;
        this.clock  = clock;
        this.ttl    = ttl;
    }

    /**
     * @return {@link StepResult.Success} holding the accumulated results, or
     *         the {@link StepResult.Failure} that stopped the run
     */
    public StepResult run(WorkflowPipeline pipeline, WorkflowExecutionContext ctx) {
        List<PipelineStep> steps;
        try {
            steps = pipeline.plan(ctx);
        } catch (RequestBindingException e) {
            log.warn("Rejected inputs for {}: {}", pipeline.workflowId(), e.getMessage());
            return StepResult.failure(FailureKind.VALIDATION, e.getMessage());
        }
        ctx.setTotalSteps(steps.size());
        save(ctx);

        for (PipelineStep step : steps) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Execution {} cancelled before step '{}'", ctx.getExecutionId(), step.name());
                return StepResult.failure(FailureKind.CANCELLED,
                        "Execution cancelled before step '" + step.name() + "'");
            }

            ctx.beginStep(step.name(), clock.instant());
            save(ctx);

            StepResult result = invoke(step, ctx);

            if (result instanceof StepResult.Success success) {
                ctx.mergeResults(success.results());
                ctx.finishStep(HighlightStatus.SUCCESS, clock.instant(), null);
                log.info("Step '{}' completed", step.name());
            } else if (result instanceof StepResult.Failure failure) {
                if (!step.fatal() && failure.kind() != FailureKind.CANCELLED) {
                    log.warn("Best-effort step '{}' failed ({}): {} - continuing",
                            step.name(), failure.kind(), failure.message());
                    ctx.finishStep(HighlightStatus.SKIPPED, clock.instant(), failure.message());
                } else {
                    log.error("Step '{}' failed ({}): {}", step.name(), failure.kind(), failure.message());
                    ctx.finishStep(HighlightStatus.FAILED, clock.instant(), failure.message());
                    save(ctx);
                    return failure;
                }
            }
            save(ctx);
            publishStatus(ctx, step.name());
        }
        return StepResult.ok(ctx.getResults());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private StepResult invoke(PipelineStep step, WorkflowExecutionContext ctx) {
        try {
            StepResult result = step.action().run(ctx);
            if (result == null) {
                return StepResult.failure(FailureKind.INFRASTRUCTURE,
                        "Step '" + step.name() + "' produced no result");
            }
            return result;
        } catch (DownstreamException e) {
            return StepResult.failure(e.failureKind(), e.getMessage());
        } catch (RequestBindingException e) {
            return StepResult.failure(FailureKind.VALIDATION, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in step '{}'", step.name(), e);
            return StepResult.failure(FailureKind.INFRASTRUCTURE,
                    "Step '" + step.name() + "' failed: " + e.getMessage());
        }
    }

    /** Status updates are best-effort; a publisher fault never fails the step. */
    private void publishStatus(WorkflowExecutionContext ctx, String stepName) {
        try {
            events.publishStatusUpdate(ctx.getWorkflowId(), ctx.getExecutionId(),
                    ctx.getStatus().name(), ctx.progressPercent(), stepName);
        } catch (RuntimeException e) {
            log.warn("Status update for step '{}' not published: {}", stepName, e.getMessage(), e);
        }
    }

    private void save(WorkflowExecutionContext ctx) {
        store.put(ctx.getExecutionId(), ctx, ttl);
    }
}
