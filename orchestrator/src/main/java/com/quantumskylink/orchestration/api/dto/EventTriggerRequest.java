package com.quantumskylink.orchestration.api.dto;

import java.util.Map;

/**
 * Request body for POST /api/orchestration/triggers/event.
 * {@code eventData} becomes the workflow's input bag; {@code headers} its context.
 */
public record EventTriggerRequest(
        String              eventType,
        String              source,
        Map<String, Object> eventData,
        Map<String, String> headers
) {
    public EventTriggerRequest {
        if (eventData == null) eventData = Map.of();
        if (headers == null) headers = Map.of();
        if (source == null || source.isBlank()) source = "external";
    }
}
