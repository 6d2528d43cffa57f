package com.quantumskylink.orchestration.pipeline.impl;

import java.time.Instant;

/** Shape of the {@code analyticsRequest} input. */
public record AnalyticsRequest(
        String requestId,
        String analyticsType,
        String timeRange,
        Boolean includeTokens,
        Boolean includeFees,
        Boolean includePricing,
        String userId,
        Instant timestamp
) {
    public AnalyticsRequest {
        analyticsType  = analyticsType == null || analyticsType.isBlank() ? "market_trends" : analyticsType;
        timeRange      = timeRange == null || timeRange.isBlank() ? "24h" : timeRange;
        includeTokens  = includeTokens  == null || includeTokens;
        includeFees    = includeFees    == null || includeFees;
        includePricing = includePricing == null || includePricing;
    }
}
