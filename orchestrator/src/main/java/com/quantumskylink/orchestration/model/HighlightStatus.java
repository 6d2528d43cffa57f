package com.quantumskylink.orchestration.model;

/**
 * State of a single pipeline step as shown in status highlights.
 * SKIPPED marks a non-fatal step that failed without stopping the run.
 */
public enum HighlightStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    SKIPPED
}
