package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.pipeline.SignedRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shape of the {@code orderRequest} input. */
public record OrderRequest(
        String orderId,
        String listingId,
        String buyerId,
        String sellerId,
        BigDecimal quantity,
        BigDecimal totalAmount,
        boolean escrowRequired,
        String nonce,
        long sequenceNumber,
        Instant timestamp,
        String signature,
        String algorithm
) implements SignedRequest {

    Map<String, Object> signedPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", orderId);
        payload.put("listingId", listingId);
        payload.put("buyerId", buyerId);
        payload.put("sellerId", sellerId);
        payload.put("quantity", quantity);
        payload.put("totalAmount", totalAmount);
        payload.put("escrowRequired", escrowRequired);
        return payload;
    }
}
