package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Verdict returned by both signature endpoints. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SignatureValidationResult(
        String validationId,
        @JsonProperty("isValid") boolean valid,
        String message
) {}
