package com.quantumskylink.orchestration.service;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of an execution for status endpoints.
 *
 * @param currentStep         running step name, or "Completed" / "Failed" once terminal
 * @param estimatedCompletion start + estimated duration while running, completion time afterwards
 * @param duration            elapsed so far, or total once terminal
 */
public record ExecutionStatusReport(
        WorkflowExecutionContext context,
        int progress,
        String currentStep,
        Instant estimatedCompletion,
        Duration duration
) {}
