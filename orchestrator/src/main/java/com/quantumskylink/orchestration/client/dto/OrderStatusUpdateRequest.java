package com.quantumskylink.orchestration.client.dto;

/** Body of PUT /api/orders/{id}/status. */
public record OrderStatusUpdateRequest(
        String status,
        String reason,
        String signatureValidationId
) {}
