package com.quantumskylink.orchestration.model;

/**
 * One named input declared by a {@link WorkflowDefinition}.
 *
 * @param name        key expected in the execution input bag
 * @param type        JSON type the value must carry
 * @param description human-readable hint shown by GET /workflows
 * @param required    missing required inputs abort execution before any downstream call
 */
public record WorkflowInput(
        String    name,
        InputType type,
        String    description,
        boolean   required) {

    public static WorkflowInput required(String name, InputType type, String description) {
        return new WorkflowInput(name, type, description, true);
    }

    public static WorkflowInput optional(String name, InputType type, String description) {
        return new WorkflowInput(name, type, description, false);
    }
}
