package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.pipeline.SignedRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shape of the {@code listingRequest} input. */
public record ListingRequest(
        String listingId,
        String tokenId,
        String sellerId,
        BigDecimal quantity,
        BigDecimal basePrice,
        String pricingModel,
        String listingType,
        String nonce,
        long sequenceNumber,
        Instant timestamp,
        String signature,
        String algorithm
) implements SignedRequest {

    Map<String, Object> signedPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("listingId", listingId);
        payload.put("tokenId", tokenId);
        payload.put("sellerId", sellerId);
        payload.put("quantity", quantity);
        payload.put("basePrice", basePrice);
        payload.put("pricingModel", pricingModel);
        payload.put("listingType", listingType);
        return payload;
    }
}
