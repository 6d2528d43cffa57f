package com.quantumskylink.orchestration.pipeline.impl;

/** Shape of the {@code userRegistration} input. Only the user id is required. */
public record UserRegistration(
        String userId,
        String email,
        String displayName
) {}
