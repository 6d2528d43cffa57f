package com.quantumskylink.orchestration.pipeline;

/**
 * Result of a signature gate.
 *
 * @param validationId causal token later steps pass downstream; null when the check failed
 */
public record SignatureCheck(boolean passed, String validationId, String message) {

    static SignatureCheck accepted(String validationId) {
        return new SignatureCheck(true, validationId, null);
    }

    static SignatureCheck rejected(String message) {
        return new SignatureCheck(false, null, message);
    }

    /** AUTHORIZATION failure for a rejected check. */
    public StepResult toFailure() {
        if (passed) {
            throw new IllegalStateException("Signature check passed");
        }
        return StepResult.unauthorized(message);
    }
}
