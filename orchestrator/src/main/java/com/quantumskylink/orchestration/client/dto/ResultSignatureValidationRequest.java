package com.quantumskylink.orchestration.client.dto;

/**
 * Body of POST /api/signatures/validate-result.
 * Checks that a downstream result was signed by the named service.
 */
public record ResultSignatureValidationRequest(
        String originalValidationId,
        Object resultData,
        String resultSignature,
        String signingService
) {}
