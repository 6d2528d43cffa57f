package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.pipeline.SignedRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shape of the {@code paymentRequest} input. */
public record PaymentRequest(
        String paymentId,
        BigDecimal amount,
        String fromAccountId,
        String toAccountId,
        String userId,
        String nonce,
        long sequenceNumber,
        Instant timestamp,
        String signature,
        String algorithm
) implements SignedRequest {

    /** Business fields covered by the client signature. */
    Map<String, Object> signedPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("paymentId", paymentId);
        payload.put("amount", amount);
        payload.put("fromAccountId", fromAccountId);
        payload.put("toAccountId", toAccountId);
        payload.put("userId", userId);
        return payload;
    }
}
