package com.quantumskylink.orchestration.client.dto;

import java.time.Instant;

/**
 * Body of POST /api/signatures/validate.
 * Binds a client signature to the account, the operation name and its payload.
 */
public record SignatureValidationRequest(
        String accountId,
        String operation,
        Object operationData,
        String nonce,
        long sequenceNumber,
        Instant timestamp,
        String signature,
        String algorithm
) {}
