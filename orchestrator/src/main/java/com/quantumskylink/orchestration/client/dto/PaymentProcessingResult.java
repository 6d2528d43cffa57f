package com.quantumskylink.orchestration.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /api/payments/process.
 * The gateway signs the result; the signature is verified before the payment is recorded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentProcessingResult(
        String paymentId,
        String transactionId,
        String status,      // "COMPLETED" | "PENDING" | "FAILED"
        String message,
        String resultSignature
) {
    public boolean failed() {
        return "FAILED".equalsIgnoreCase(status);
    }
}
