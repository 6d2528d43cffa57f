package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response from GET /api/users/{userId}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
        String userId,
        String email,
        String displayName,
        String status
) {}
