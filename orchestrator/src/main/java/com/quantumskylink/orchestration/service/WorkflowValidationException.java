package com.quantumskylink.orchestration.service;

import java.util.List;

/**
 * Thrown before any side effect when a workflow id is unknown or its inputs
 * do not validate. Carries every error, not just the first.
 */
public class WorkflowValidationException extends RuntimeException {

    private final String       workflowId;
    private final List<String> errors;

    public WorkflowValidationException(String workflowId, List<String> errors) {
        super("Workflow validation failed: " + String.join("; ", errors));
        this.workflowId = workflowId;
        this.errors     = List.copyOf(errors);
    }

    public String       getWorkflowId() { return workflowId; }
    public List<String> getErrors()     { return errors; }
}
