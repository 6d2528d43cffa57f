package com.quantumskylink.orchestration.service;

import com.quantumskylink.orchestration.catalog.WorkflowCatalog;
import com.quantumskylink.orchestration.model.WorkflowDefinition;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.impl.OnboardingPipeline;
import com.quantumskylink.orchestration.repository.ExecutionContextStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read-only views over the execution context store.
 * Unknown and expired ids both raise {@link ExecutionNotFoundException}.
 */
@Service
public class WorkflowStatusService {

    static final String STEP_INITIALIZING = "Initializing";
    static final String STEP_COMPLETED    = "Completed";
    static final String STEP_FAILED       = "Failed";

    private final ExecutionContextStore store;
    private final WorkflowCatalog       catalog;
    private final Clock                 clock;

    public WorkflowStatusService(ExecutionContextStore store, WorkflowCatalog catalog, Clock clock) {
        this.store   = store;
        this.catalog = catalog;
        this.clock   = clock;
    }

    public WorkflowExecutionContext getStatus(String executionId) {
        return store.get(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    /** 0..100; reaches 100 only for a successful execution. */
    public int getProgress(String executionId) {
        return getStatus(executionId).progressPercent();
    }

    public ExecutionStatusReport describe(String executionId) {
        return report(getStatus(executionId));
    }

    /**
     * Onboarding status by user id or execution id.
     * The user index wins; otherwise {@code id} is taken as an execution id.
     */
    public ExecutionStatusReport describeOnboarding(String id) {
        Optional<WorkflowExecutionContext> byUser = store.getByIndex(OnboardingPipeline.indexKey(id))
                .flatMap(store::get);
        return report(byUser.orElseGet(() -> getStatus(id)));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ExecutionStatusReport report(WorkflowExecutionContext ctx) {
        Instant end = ctx.getCompletedAt() != null ? ctx.getCompletedAt() : clock.instant();
        return new ExecutionStatusReport(
                ctx,
                ctx.progressPercent(),
                friendlyStep(ctx),
                estimatedCompletion(ctx),
                Duration.between(ctx.getStartedAt(), end));
    }

    private static String friendlyStep(WorkflowExecutionContext ctx) {
        return switch (ctx.getStatus()) {
            case SUCCESS -> STEP_COMPLETED;
            case FAILED  -> STEP_FAILED;
            case RUNNING -> ctx.getCurrentStep() != null ? ctx.getCurrentStep() : STEP_INITIALIZING;
        };
    }

    private Instant estimatedCompletion(WorkflowExecutionContext ctx) {
        if (ctx.getCompletedAt() != null) {
            return ctx.getCompletedAt();
        }
        return catalog.get(ctx.getWorkflowId())
                .map(WorkflowDefinition::estimatedDuration)
                .map(ctx.getStartedAt()::plus)
                .orElse(null);
    }
}
