package com.quantumskylink.orchestration.model;

/**
 * Why a pipeline stopped before its last step.
 */
public enum FailureKind {
    /** The input bag could not be bound to the workflow's request shape. */
    VALIDATION,
    /** A presented or returned signature was rejected. */
    AUTHORIZATION,
    /** A collaborator answered but refused the operation. */
    BUSINESS,
    /** Timeout, unreachable collaborator, serialization fault. */
    INFRASTRUCTURE,
    /** The calling thread was interrupted between or during steps. */
    CANCELLED;

    /** True when the caller, not the platform, can fix the failure. */
    public boolean isClientCaused() {
        return this == VALIDATION;
    }
}
