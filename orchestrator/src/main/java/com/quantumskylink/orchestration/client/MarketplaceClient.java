package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.client.dto.*;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Client for the marketplace service: listings, orders and analytics.
 */
@Component
public class MarketplaceClient {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceClient.class);

    private final ServiceHttpClient http;

    public MarketplaceClient(
            @Value("${skylink.services.marketplace.base-url}") String baseUrl,
            @Value("${skylink.services.marketplace.timeout:10s}") Duration timeout,
            @Value("${skylink.services.marketplace.retries:2}") int retries,
            @Value("${skylink.services.retry-backoff:1s}") Duration backoff,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.http = new ServiceHttpClient("marketplace", baseUrl,
                new CallPolicy(timeout, retries, backoff), objectMapper, meterRegistry);
    }

    // ------------------------------------------------------------------
    // Listings and orders
    // ------------------------------------------------------------------

    public ListingCreationResult createListing(ListingCreationRequest request) {
        log.info("Creating listing {} for seller {}", request.listingId(), request.sellerId());
        return require(http.post("createListing", "/api/listings", request, ListingCreationResult.class),
                "createListing");
    }

    public MarketplaceValidationResult validateListing(String listingId, ListingValidationRequest request) {
        return require(http.post("validateListing", "/api/listings/" + segment(listingId) + "/validate",
                request, MarketplaceValidationResult.class), "validateListing");
    }

    public OrderCreationResult createOrder(OrderCreationRequest request) {
        log.info("Creating order {} on listing {}", request.orderId(), request.listingId());
        return require(http.post("createOrder", "/api/orders", request, OrderCreationResult.class),
                "createOrder");
    }

    public MarketplaceValidationResult verifyOrder(String orderId, OrderVerificationRequest request) {
        return require(http.post("verifyOrder", "/api/orders/" + segment(orderId) + "/verify",
                request, MarketplaceValidationResult.class), "verifyOrder");
    }

    public OrderStatusUpdateResult updateOrderStatus(String orderId, OrderStatusUpdateRequest request) {
        log.info("Updating order {} to {}", orderId, request.status());
        return require(http.put("updateOrderStatus", "/api/orders/" + segment(orderId) + "/status",
                request, OrderStatusUpdateResult.class), "updateOrderStatus");
    }

    // ------------------------------------------------------------------
    // Analytics
    // ------------------------------------------------------------------

    public AnalyticsStageResult listingAnalytics(AnalyticsQuery query) {
        return analytics("listingAnalytics", "/api/analytics/listings", query);
    }

    public AnalyticsStageResult orderAnalytics(AnalyticsQuery query) {
        return analytics("orderAnalytics", "/api/analytics/orders", query);
    }

    public AnalyticsStageResult calculateTrends(AnalyticsQuery query) {
        return analytics("calculateTrends", "/api/analytics/calculate-trends", query);
    }

    public AnalyticsStageResult aggregate(AnalyticsQuery query) {
        return analytics("aggregate", "/api/analytics/aggregate", query);
    }

    public AnalyticsStageResult generateReport(AnalyticsQuery query) {
        return analytics("generateReport", "/api/analytics/report", query);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private AnalyticsStageResult analytics(String op, String path, AnalyticsQuery query) {
        return require(http.post(op, path, query, AnalyticsStageResult.class), op);
    }

    private <T> T require(T body, String op) {
        if (body == null) {
            throw new DownstreamException(http.getService(), op + " returned an empty body", 502);
        }
        return body;
    }

    private static String segment(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
