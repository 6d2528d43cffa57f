package com.quantumskylink.orchestration.api.dto;

import com.quantumskylink.orchestration.model.ValidationResult;

import java.util.List;

public record ValidationResponse(
        boolean      valid,
        List<String> errors,
        List<String> warnings,
        Long         estimatedDurationSeconds
) {
    public static ValidationResponse from(ValidationResult result) {
        return new ValidationResponse(
                result.valid(),
                result.errors(),
                result.warnings(),
                result.estimatedDuration() == null ? null : result.estimatedDuration().toSeconds()
        );
    }
}
