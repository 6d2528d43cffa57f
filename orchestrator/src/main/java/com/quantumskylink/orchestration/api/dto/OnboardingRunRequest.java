package com.quantumskylink.orchestration.api.dto;

/** Request body for POST /api/orchestration/onboarding/run. */
public record OnboardingRunRequest(String userId) {}
