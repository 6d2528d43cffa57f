package com.quantumskylink.orchestration.pipeline;

import java.util.Objects;

/**
 * One named step of a workflow pipeline.
 *
 * @param name   human-readable step name, shown in status highlights
 * @param fatal  false for best-effort steps whose failure is logged and skipped
 * @param action step body
 */
public record PipelineStep(String name, boolean fatal, StepAction action) {

    public PipelineStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
    }

    public static PipelineStep fatal(String name, StepAction action) {
        return new PipelineStep(name, true, action);
    }

    public static PipelineStep bestEffort(String name, StepAction action) {
        return new PipelineStep(name, false, action);
    }
}
