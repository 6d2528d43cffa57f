package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;

/**
 * Body of a pipeline step.
 *
 * Implementations return a {@link StepResult.Failure} for expected
 * rejections. Anything thrown is classified by {@link PipelineRunner}.
 */
@FunctionalInterface
public interface StepAction {

    StepResult run(WorkflowExecutionContext context);
}
