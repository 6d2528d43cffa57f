package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.model.FailureKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tagged outcome of one pipeline step.
 *
 * Steps report rejection as a {@link Failure} value instead of throwing, so
 * the executor can branch on {@link FailureKind} directly.
 */
public sealed interface StepResult permits StepResult.Success, StepResult.Failure {

    record Success(Map<String, Object> results) implements StepResult {
        public Success {
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        }
    }

    record Failure(FailureKind kind, String message) implements StepResult {}

    static StepResult ok() {
        return new Success(Map.of());
    }

    static StepResult ok(Map<String, ?> results) {
        Map<String, Object> copy = new LinkedHashMap<>();
        results.forEach((k, v) -> {
            if (v != null) copy.put(k, v);
        });
        return new Success(copy);
    }

    static StepResult failure(FailureKind kind, String message) {
        return new Failure(kind, message);
    }

    static StepResult unauthorized(String message) {
        return new Failure(FailureKind.AUTHORIZATION, message);
    }

    static StepResult rejected(String message) {
        return new Failure(FailureKind.BUSINESS, message);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
