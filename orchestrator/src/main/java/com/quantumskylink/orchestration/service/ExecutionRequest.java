package com.quantumskylink.orchestration.service;

import java.util.List;
import java.util.Map;

/**
 * One request to run a workflow.
 *
 * @param context  free-form string metadata recorded on the execution
 * @param priority 1 (lowest) to 10 (highest); null means 5
 */
public record ExecutionRequest(
        String workflowId,
        Map<String, Object> inputs,
        String triggeredBy,
        Map<String, String> context,
        String description,
        Integer priority
) {
    public static final int DEFAULT_PRIORITY = 5;

    public ExecutionRequest {
        inputs   = inputs  == null ? Map.of() : inputs;
        context  = context == null ? Map.of() : context;
        priority = priority == null ? DEFAULT_PRIORITY : priority;
        if (priority < 1 || priority > 10) {
            throw new WorkflowValidationException(workflowId,
                    List.of("Priority must be between 1 and 10"));
        }
    }

    public static ExecutionRequest of(String workflowId, Map<String, Object> inputs, String triggeredBy) {
        return new ExecutionRequest(workflowId, inputs, triggeredBy, null, null, null);
    }
}
