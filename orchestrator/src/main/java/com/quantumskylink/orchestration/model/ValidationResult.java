package com.quantumskylink.orchestration.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking an input bag against a {@link WorkflowDefinition}.
 * Computing it never creates an execution.
 *
 * @param errors   one entry per violated rule, in input declaration order
 * @param warnings inputs supplied but not declared; never affect validity
 */
public record ValidationResult(
        boolean      valid,
        List<String> errors,
        List<String> warnings,
        Duration     estimatedDuration) {

    public ValidationResult {
        errors   = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, List.of(error), List.of(), null);
    }

    /** This result with {@code more} errors appended; invalid whenever any error exists. */
    public ValidationResult withErrors(List<String> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<String> all = new ArrayList<>(errors);
        all.addAll(more);
        return new ValidationResult(false, all, warnings, estimatedDuration);
    }
}
