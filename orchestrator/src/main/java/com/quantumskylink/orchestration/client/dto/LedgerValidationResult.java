package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerValidationResult(
        String validationId,
        @JsonProperty("isValid") boolean valid,
        String message
) {}
