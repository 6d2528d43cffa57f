package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListingCreationResult(
        String listingId,
        String tokenId,
        String status
) {}
