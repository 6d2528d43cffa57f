package com.quantumskylink.orchestration.model;

import java.time.Duration;
import java.util.List;

/**
 * Static description of a workflow type. Loaded once at startup and never
 * mutated by an execution.
 *
 * Inputs are kept in declaration order so validation reports errors in a
 * stable order.
 */
public record WorkflowDefinition(
        String              id,
        String              name,
        String              description,
        String              namespace,
        String              version,
        List<String>        tags,
        List<WorkflowInput> inputs,
        Duration            estimatedDuration,
        boolean             active) {

    public WorkflowDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("workflow id must not be blank");
        }
        tags   = tags   == null ? List.of() : List.copyOf(tags);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
