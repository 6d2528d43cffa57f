package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.pipeline.SignedRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape of the {@code escrowRequest} input.
 * {@code action} is "release" (seller signs) or anything else, e.g. "refund" (buyer signs).
 */
public record EscrowRequest(
        String escrowId,
        String orderId,
        String action,
        String buyerId,
        String sellerId,
        BigDecimal amount,
        String reason,
        String nonce,
        long sequenceNumber,
        Instant timestamp,
        String signature,
        String algorithm
) implements SignedRequest {

    static final String RELEASE = "release";

    boolean isRelease() {
        return RELEASE.equals(action);
    }

    String signerId() {
        return isRelease() ? sellerId : buyerId;
    }

    Map<String, Object> signedPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escrowId", escrowId);
        payload.put("orderId", orderId);
        payload.put("action", action);
        payload.put("buyerId", buyerId);
        payload.put("sellerId", sellerId);
        payload.put("amount", amount);
        payload.put("reason", reason);
        return payload;
    }
}
