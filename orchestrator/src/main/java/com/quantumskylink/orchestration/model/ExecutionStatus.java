package com.quantumskylink.orchestration.model;

/**
 * Lifecycle of one workflow execution.
 *
 * Transitions:
 *   RUNNING → SUCCESS
 *   RUNNING → FAILED
 *
 * Both terminal states are final; a context leaves RUNNING exactly once.
 */
public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
