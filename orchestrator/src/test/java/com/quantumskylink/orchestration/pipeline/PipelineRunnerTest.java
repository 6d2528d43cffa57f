package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.client.DownstreamException;
import com.quantumskylink.orchestration.event.WorkflowEventPublisher;
import com.quantumskylink.orchestration.model.FailureKind;
import com.quantumskylink.orchestration.model.HighlightStatus;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.model.WorkflowHighlight;
import com.quantumskylink.orchestration.repository.ExecutionContextStore;
import com.quantumskylink.orchestration.support.Fixtures;
import com.quantumskylink.orchestration.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    private static final Duration TTL = Duration.ofHours(1);

    @Mock ExecutionContextStore  store;
    @Mock WorkflowEventPublisher events;

    private PipelineRunner           runner;
    private WorkflowExecutionContext ctx;

    @BeforeEach
    void setUp() {
        runner = new PipelineRunner(store, events, new MutableClock(Fixtures.T0), TTL);
        ctx    = Fixtures.context("test-wf", Map.of());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_allStepsSucceed_mergesResultsInOrder() {
        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("one", c -> StepResult.ok(Map.of("a", 1))),
                PipelineStep.fatal("two", c -> StepResult.ok(Map.of("b", 2)))), ctx);

        assertThat(result).isInstanceOf(StepResult.Success.class);
        assertThat(((StepResult.Success) result).results()).containsEntry("a", 1).containsEntry("b", 2);
        assertThat(ctx.getTotalSteps()).isEqualTo(2);
        assertThat(ctx.getCompletedSteps()).isEqualTo(2);
        assertThat(ctx.getHighlights()).extracting(WorkflowHighlight::status)
                .containsExactly(HighlightStatus.SUCCESS, HighlightStatus.SUCCESS);
    }

    @Test
    void run_savesContextAfterPlanningAndAroundEveryStep() {
        runner.run(pipeline(
                PipelineStep.fatal("one", c -> StepResult.ok()),
                PipelineStep.fatal("two", c -> StepResult.ok())), ctx);

        verify(store, times(5)).put(eq("exec-1"), any(WorkflowExecutionContext.class), eq(TTL));
    }

    @Test
    void run_publishesStatusUpdatePerStep() {
        runner.run(pipeline(
                PipelineStep.fatal("one", c -> StepResult.ok()),
                PipelineStep.fatal("two", c -> StepResult.ok())), ctx);

        verify(events).publishStatusUpdate("test-wf", "exec-1", "RUNNING", 50, "one");
        verify(events).publishStatusUpdate("test-wf", "exec-1", "RUNNING", 99, "two");
    }

    @Test
    void run_statusPublisherFault_doesNotFailTheStep() {
        doThrow(new RuntimeException("sink down"))
                .when(events).publishStatusUpdate(anyString(), anyString(), anyString(), anyInt(), anyString());

        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("one", c -> StepResult.ok(Map.of("a", 1))),
                PipelineStep.fatal("two", c -> StepResult.ok())), ctx);

        assertThat(result).isInstanceOf(StepResult.Success.class);
        assertThat(ctx.getHighlights()).extracting(WorkflowHighlight::status)
                .containsExactly(HighlightStatus.SUCCESS, HighlightStatus.SUCCESS);
    }

    @Test
    void run_laterStepSeesEarlierResults() {
        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("one", c -> StepResult.ok(Map.of("token", "t-1"))),
                PipelineStep.fatal("two", c -> StepResult.ok(Map.of("echo", c.getResults().get("token"))))), ctx);

        assertThat(((StepResult.Success) result).results()).containsEntry("echo", "t-1");
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void run_fatalFailure_stopsAndReturnsIt() {
        AtomicBoolean secondRan = new AtomicBoolean();

        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("one", c -> StepResult.unauthorized("Signature validation failed: bad")),
                PipelineStep.fatal("two", c -> { secondRan.set(true); return StepResult.ok(); })), ctx);

        assertThat(result).isEqualTo(new StepResult.Failure(FailureKind.AUTHORIZATION,
                "Signature validation failed: bad"));
        assertThat(secondRan).isFalse();
        assertThat(ctx.getCurrentStep()).isEqualTo("one");
        assertThat(ctx.getHighlights()).extracting(WorkflowHighlight::status)
                .containsExactly(HighlightStatus.FAILED);
        verify(events, never()).publishStatusUpdate(anyString(), anyString(), anyString(), anyInt(), anyString());
    }

    @Test
    void run_bestEffortFailure_isSkippedAndRunContinues() {
        StepResult result = runner.run(pipeline(
                PipelineStep.bestEffort("optional", c -> StepResult.rejected("not there")),
                PipelineStep.fatal("required", c -> StepResult.ok(Map.of("done", true)))), ctx);

        assertThat(result.isSuccess()).isTrue();
        assertThat(ctx.getHighlights()).extracting(WorkflowHighlight::status)
                .containsExactly(HighlightStatus.SKIPPED, HighlightStatus.SUCCESS);
        assertThat(ctx.getHighlights().get(0).message()).isEqualTo("not there");
        assertThat(ctx.getCompletedSteps()).isEqualTo(2);
    }

    @Test
    void run_bestEffortThrowingDownstreamFault_isSkipped() {
        StepResult result = runner.run(pipeline(
                PipelineStep.bestEffort("optional", c -> {
                    throw new DownstreamException("user-service", "user-service.getUser failed: HTTP 503: down", 503);
                }),
                PipelineStep.fatal("required", c -> StepResult.ok())), ctx);

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void run_downstreamClientError_isBusinessFailure() {
        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("call", c -> {
                    throw new DownstreamException("ledger", "ledger.validate failed: HTTP 422: nope", 422);
                })), ctx);

        assertThat(result).isEqualTo(new StepResult.Failure(FailureKind.BUSINESS,
                "ledger.validate failed: HTTP 422: nope"));
    }

    @Test
    void run_downstreamServerError_isInfrastructureFailure() {
        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("call", c -> {
                    throw new DownstreamException("ledger", "ledger.validate failed: HTTP 503: down", 503);
                })), ctx);

        assertThat(((StepResult.Failure) result).kind()).isEqualTo(FailureKind.INFRASTRUCTURE);
    }

    @Test
    void run_unexpectedException_isInfrastructureFailureNamingStep() {
        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("Record", c -> { throw new NullPointerException("payment"); })), ctx);

        assertThat(result).isEqualTo(new StepResult.Failure(FailureKind.INFRASTRUCTURE,
                "Step 'Record' failed: payment"));
    }

    @Test
    void run_nullStepResult_isInfrastructureFailure() {
        StepResult result = runner.run(pipeline(PipelineStep.fatal("broken", c -> null)), ctx);

        assertThat(((StepResult.Failure) result).kind()).isEqualTo(FailureKind.INFRASTRUCTURE);
    }

    @Test
    void run_planRejectsInputs_isValidationFailureWithNoSteps() {
        WorkflowPipeline rejecting = pipeline(c -> {
            throw new RequestBindingException("Required input missing: paymentRequest");
        });

        StepResult result = runner.run(rejecting, ctx);

        assertThat(result).isEqualTo(new StepResult.Failure(FailureKind.VALIDATION,
                "Required input missing: paymentRequest"));
        assertThat(ctx.getHighlights()).isEmpty();
        verify(store, never()).put(anyString(), any(), any());
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void run_interruptedBetweenSteps_cancelsBeforeNextStep() {
        AtomicBoolean secondRan = new AtomicBoolean();

        StepResult result = runner.run(pipeline(
                PipelineStep.fatal("one", c -> { Thread.currentThread().interrupt(); return StepResult.ok(); }),
                PipelineStep.fatal("two", c -> { secondRan.set(true); return StepResult.ok(); })), ctx);

        assertThat(result).isEqualTo(new StepResult.Failure(FailureKind.CANCELLED,
                "Execution cancelled before step 'two'"));
        assertThat(secondRan).isFalse();
        assertThat(ctx.getCompletedSteps()).isEqualTo(1);
    }

    @Test
    void run_cancelledBestEffortStep_isNotSkipped() {
        StepResult result = runner.run(pipeline(
                PipelineStep.bestEffort("optional", c -> {
                    throw DownstreamException.cancelled("user-service", "user-service.getUser interrupted",
                            new InterruptedException());
                }),
                PipelineStep.fatal("required", c -> StepResult.ok())), ctx);

        assertThat(((StepResult.Failure) result).kind()).isEqualTo(FailureKind.CANCELLED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WorkflowPipeline pipeline(PipelineStep... steps) {
        return pipeline(c -> List.of(steps));
    }

    private static WorkflowPipeline pipeline(Function<WorkflowExecutionContext, List<PipelineStep>> planner) {
        return new WorkflowPipeline() {
            @Override
            public String workflowId() {
                return "test-wf";
            }

            @Override
            public List<PipelineStep> plan(WorkflowExecutionContext context) {
                return planner.apply(context);
            }
        };
    }
}
