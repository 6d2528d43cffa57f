package com.quantumskylink.orchestration.client.dto;

/** Body of POST /api/orders/{id}/verify. */
public record OrderVerificationRequest(
        String escrowId,
        String action,
        String requesterId
) {}
