package com.quantumskylink.orchestration.api.dto;

import com.quantumskylink.orchestration.model.WorkflowHighlight;

import java.time.Instant;

public record HighlightResponse(
        String  step,
        String  status,
        Instant timestamp,
        Long    durationMs,
        String  message
) {
    public static HighlightResponse from(WorkflowHighlight h) {
        return new HighlightResponse(
                h.step(),
                h.status().name(),
                h.timestamp(),
                h.duration() == null ? null : h.duration().toMillis(),
                h.message()
        );
    }
}
