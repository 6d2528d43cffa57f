package com.quantumskylink.orchestration.client.dto;

import java.math.BigDecimal;

/** Body of POST /api/listings. */
public record ListingCreationRequest(
        String listingId,
        String tokenId,
        String sellerId,
        BigDecimal quantity,
        BigDecimal basePrice,
        String pricingModel,
        String listingType,
        String signatureValidationId
) {}
