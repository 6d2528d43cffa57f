package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderCreationResult(
        String orderId,
        String listingId,
        String status
) {}
