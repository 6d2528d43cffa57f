package com.quantumskylink.orchestration.catalog;

import com.quantumskylink.orchestration.model.ValidationResult;
import com.quantumskylink.orchestration.model.WorkflowDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of workflow definitions.
 *
 * Built once from a fixed list (see {@link WorkflowCatalogConfiguration})
 * and handed to the executor by constructor injection. There is no runtime
 * registration: a new workflow type ships with a new build.
 */
public final class WorkflowCatalog {

    private final Map<String, WorkflowDefinition> definitions;
    // Map.copyOf drops insertion order; listActive() needs it.
    private final List<String>                    order;

    public WorkflowCatalog(Collection<WorkflowDefinition> definitions) {
        Map<String, WorkflowDefinition> byId = new LinkedHashMap<>();
        for (WorkflowDefinition def : definitions) {
            if (byId.putIfAbsent(def.id(), def) != null) {
                throw new IllegalArgumentException("Duplicate workflow id: " + def.id());
            }
        }
        this.definitions = Map.copyOf(byId);
        this.order       = List.copyOf(byId.keySet());
    }

    public Optional<WorkflowDefinition> get(String workflowId) {
        return Optional.ofNullable(workflowId).map(definitions::get);
    }

    /** Active definitions in declaration order. */
    public List<WorkflowDefinition> listActive() {
        return order.stream()
                .map(definitions::get)
                .filter(WorkflowDefinition::active)
                .toList();
    }

    /** All ids, active or not, in declaration order. */
    public List<String> ids() {
        return order;
    }

    /**
     * Validate an input bag without executing anything.
     * Unknown workflow ids yield an invalid result rather than an exception.
     */
    public ValidationResult validate(String workflowId, Map<String, Object> inputs) {
        return get(workflowId)
                .map(def -> InputValidator.validate(def, inputs))
                .orElseGet(() -> ValidationResult.invalid("Workflow not found: " + workflowId));
    }
}
