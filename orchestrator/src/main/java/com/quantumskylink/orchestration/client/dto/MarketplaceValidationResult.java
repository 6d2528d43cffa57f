package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Verdict from the listing validation and order verification endpoints. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketplaceValidationResult(
        @JsonProperty("isValid") boolean valid,
        String message
) {}
