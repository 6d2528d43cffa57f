package com.quantumskylink.orchestration.api.dto;

import com.quantumskylink.orchestration.model.WorkflowDefinition;

import java.util.List;

/** Entry of GET /api/orchestration/workflows. */
public record WorkflowDefinitionResponse(
        String              id,
        String              name,
        String              description,
        String              namespace,
        String              version,
        List<String>        tags,
        List<InputResponse> inputs,
        Long                estimatedDurationSeconds
) {
    public record InputResponse(String name, String type, String description, boolean required) {}

    public static WorkflowDefinitionResponse from(WorkflowDefinition def) {
        return new WorkflowDefinitionResponse(
                def.id(),
                def.name(),
                def.description(),
                def.namespace(),
                def.version(),
                def.tags(),
                def.inputs().stream()
                        .map(i -> new InputResponse(i.name(), i.type().name(), i.description(), i.required()))
                        .toList(),
                def.estimatedDuration() == null ? null : def.estimatedDuration().toSeconds()
        );
    }
}
