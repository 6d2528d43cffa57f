package com.quantumskylink.orchestration.api.dto;

import java.util.List;

/**
 * @param triggerResult "TRIGGERED" or "IGNORED"
 * @param executionIds  empty when ignored
 */
public record EventTriggerResponse(String triggerResult, List<String> executionIds, String message) {

    public static final String TRIGGERED = "TRIGGERED";
    public static final String IGNORED   = "IGNORED";

    public static EventTriggerResponse triggered(String executionId, String message) {
        return new EventTriggerResponse(TRIGGERED, List.of(executionId), message);
    }

    public static EventTriggerResponse ignored(String eventType) {
        return new EventTriggerResponse(IGNORED, List.of(), "No workflow mapped for event type: " + eventType);
    }
}
