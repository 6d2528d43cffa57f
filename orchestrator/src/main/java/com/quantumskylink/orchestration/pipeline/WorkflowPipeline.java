package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Step sequence for one workflow id.
 *
 * Implementations are Spring beans collected by {@link PipelineRegistry}.
 * Adding a workflow means adding a bean; the executor's dispatch does not change.
 */
public interface WorkflowPipeline {

    /** Catalog id this pipeline serves. */
    String workflowId();

    /**
     * Bind the execution's inputs and lay out its steps in order.
     *
     * Called once per execution. Steps may share state through the
     * objects captured here, since no two steps of one execution overlap.
     *
     * @throws RequestBindingException if the inputs cannot be read as this workflow's request
     */
    List<PipelineStep> plan(WorkflowExecutionContext context);

    /**
     * Every reason {@link #plan} would reject these inputs. Pure; the executor
     * calls it before an execution exists.
     */
    default List<String> validateRequest(Map<String, Object> inputs) {
        return List.of();
    }

    /**
     * Lookup key written to the context store's secondary index at dispatch time.
     * Evaluated before any step runs, so it must not depend on step output.
     */
    default Optional<String> secondaryKey(Map<String, Object> inputs) {
        return Optional.empty();
    }

    /** Event to publish once the execution has succeeded, if any. */
    default Optional<CompletionEvent> completionEvent(WorkflowExecutionContext finished) {
        return Optional.empty();
    }
}
