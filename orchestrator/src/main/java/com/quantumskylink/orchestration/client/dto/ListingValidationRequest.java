package com.quantumskylink.orchestration.client.dto;

import java.math.BigDecimal;

/** Body of POST /api/listings/{id}/validate. Checks that the listing can cover an order. */
public record ListingValidationRequest(
        String buyerId,
        BigDecimal quantity
) {}
