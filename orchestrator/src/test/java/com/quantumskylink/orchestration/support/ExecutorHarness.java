package com.quantumskylink.orchestration.support;

import com.quantumskylink.orchestration.event.WorkflowEventPublisher;
import com.quantumskylink.orchestration.pipeline.PipelineRegistry;
import com.quantumskylink.orchestration.pipeline.PipelineRunner;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import com.quantumskylink.orchestration.repository.InMemoryExecutionContextStore;
import com.quantumskylink.orchestration.service.WorkflowExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * A real executor, runner and store around one pipeline under test.
 * Only the event publisher is mocked.
 */
public final class ExecutorHarness {

    public static final Duration TTL = Duration.ofHours(24);

    public final MutableClock                  clock  = new MutableClock(Fixtures.T0);
    public final InMemoryExecutionContextStore store  = new InMemoryExecutionContextStore(clock);
    public final WorkflowEventPublisher        events = mock(WorkflowEventPublisher.class);
    public final SimpleMeterRegistry           meters = new SimpleMeterRegistry();
    public final WorkflowExecutor              executor;

    public ExecutorHarness(WorkflowPipeline pipeline) {
        PipelineRunner runner = new PipelineRunner(store, events, clock, TTL);
        this.executor = new WorkflowExecutor(
                Fixtures.catalogOf(pipeline.workflowId()),
                new PipelineRegistry(List.of(pipeline)),
                runner, store, events, meters, clock, TTL);
    }
}
