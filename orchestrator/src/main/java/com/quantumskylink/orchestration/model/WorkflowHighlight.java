package com.quantumskylink.orchestration.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Human-readable progress marker for one pipeline step.
 */
public record WorkflowHighlight(
        String          step,
        HighlightStatus status,
        Instant         timestamp,
        Duration        duration,
        String          message) {

    public static WorkflowHighlight started(String step, Instant at) {
        return new WorkflowHighlight(step, HighlightStatus.RUNNING, at, null, null);
    }

    /** Close a RUNNING highlight with its final status. */
    public WorkflowHighlight finish(HighlightStatus finalStatus, Instant at, String finalMessage) {
        return new WorkflowHighlight(step, finalStatus, timestamp,
                Duration.between(timestamp, at), finalMessage);
    }
}
