package com.quantumskylink.orchestration.client.dto;

import java.math.BigDecimal;

/** Body of POST /api/payments/process. */
public record PaymentProcessingRequest(
        String paymentId,
        BigDecimal amount,
        String fromAccountId,
        String toAccountId,
        String userId,
        String signatureValidationId,
        String ledgerValidationId
) {}
