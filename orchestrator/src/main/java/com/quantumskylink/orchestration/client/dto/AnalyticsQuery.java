package com.quantumskylink.orchestration.client.dto;

/**
 * Body shared by the analytics endpoints.
 * {@code payload} carries the previous stage's output where a stage needs it.
 */
public record AnalyticsQuery(
        String requestId,
        String analyticsType,
        String timeRange,
        boolean includeTokens,
        boolean includeFees,
        boolean includePricing,
        Object payload
) {
    public AnalyticsQuery withPayload(Object next) {
        return new AnalyticsQuery(requestId, analyticsType, timeRange,
                includeTokens, includeFees, includePricing, next);
    }
}
