package com.quantumskylink.orchestration.catalog;

import com.quantumskylink.orchestration.model.ValidationResult;
import com.quantumskylink.orchestration.model.WorkflowDefinition;
import com.quantumskylink.orchestration.model.WorkflowInput;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure check of an input bag against the inputs a definition declares.
 *
 * Errors:   required input missing, or supplied value of the wrong type.
 * Warnings: supplied input that the definition does not declare.
 */
final class InputValidator {

    private InputValidator() {}

    static ValidationResult validate(WorkflowDefinition definition, Map<String, Object> inputs) {
        Map<String, Object> bag = inputs == null ? Map.of() : inputs;
        List<String> errors   = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (WorkflowInput input : definition.inputs()) {
            Object value = bag.get(input.name());
            if (value == null) {
                if (input.required()) {
                    errors.add("Required input missing: " + input.name());
                }
            } else if (!input.type().accepts(value)) {
                errors.add("Input '" + input.name() + "' must be of type " + input.type());
            }
        }

        Set<String> declared = definition.inputs().stream()
                .map(WorkflowInput::name)
                .collect(Collectors.toSet());
        bag.keySet().stream()
                .filter(name -> !declared.contains(name))
                .sorted()
                .forEach(name -> warnings.add("Undeclared input ignored: " + name));

        return new ValidationResult(errors.isEmpty(), errors, warnings, definition.estimatedDuration());
    }
}
