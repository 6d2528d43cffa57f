package com.quantumskylink.orchestration.service;

/** Thrown for an execution id that never existed or whose entry has expired. */
public class ExecutionNotFoundException extends RuntimeException {

    private final String executionId;

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
