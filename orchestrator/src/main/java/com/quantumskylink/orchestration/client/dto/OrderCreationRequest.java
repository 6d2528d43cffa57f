package com.quantumskylink.orchestration.client.dto;

import java.math.BigDecimal;

/** Body of POST /api/orders. */
public record OrderCreationRequest(
        String orderId,
        String listingId,
        String buyerId,
        String sellerId,
        BigDecimal quantity,
        BigDecimal totalAmount,
        boolean escrowRequired,
        String signatureValidationId
) {}
