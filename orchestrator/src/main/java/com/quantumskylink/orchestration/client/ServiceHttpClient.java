package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON-over-HTTP helper shared by every collaborator client.
 *
 * Owns one {@link HttpClient}, one Resilience4j {@link Retry} built from the
 * collaborator's {@link CallPolicy}, and the per-call metrics:
 * <pre>
 *   skylink.downstream.calls{service, operation, status="success|error"}
 *   skylink.downstream.duration{service, operation}
 * </pre>
 *
 * Every failure leaves as a {@link DownstreamException}. Only retryable ones
 * (I/O faults, timeouts, 5xx, 429) are attempted again.
 */
public class ServiceHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ServiceHttpClient.class);

    private final String        service;
    private final String        baseUrl;
    private final CallPolicy    policy;
    private final ObjectMapper  json;
    private final MeterRegistry meterRegistry;
    private final HttpClient    http;
    private final Retry         retry;

    public ServiceHttpClient(String service,
                             String baseUrl,
                             CallPolicy policy,
                             ObjectMapper objectMapper,
                             MeterRegistry meterRegistry) {
        this.service       = service;
        this.baseUrl       = stripTrailingSlash(baseUrl);
        this.policy        = policy;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.http          = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(policy.timeout())
                .build();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(policy.retries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(policy.initialBackoff(), 2.0))
                .retryOnException(e -> e instanceof DownstreamException d && d.isRetryable())
                .build();
        this.retry = Retry.of(service, config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retry {} for {} after {}ms: {}",
                        event.getNumberOfRetryAttempts(), service,
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    // ------------------------------------------------------------------
    // Verbs
    // ------------------------------------------------------------------

    public <T> T get(String operation, String path, Class<T> responseType) {
        return call(operation, "GET", path, null, json.constructType(responseType));
    }

    public <T> T post(String operation, String path, Object body, Class<T> responseType) {
        return call(operation, "POST", path, body, json.constructType(responseType));
    }

    public <T> T post(String operation, String path, Object body, TypeReference<T> responseType) {
        return call(operation, "POST", path, body, json.constructType(responseType));
    }

    public <T> T put(String operation, String path, Object body, Class<T> responseType) {
        return call(operation, "PUT", path, body, json.constructType(responseType));
    }

    public String getService() {
        return service;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private <T> T call(String operation, String method, String path, Object body, JavaType responseType) {
        String payload = body == null ? null : toJson(body);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return retry.executeSupplier(() -> sendOnce(operation, method, path, payload, responseType));
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("skylink.downstream.duration",
                    "service", service, "operation", operation));
            meterRegistry.counter("skylink.downstream.calls",
                    "service", service, "operation", operation, "status", status).increment();
        }
    }

    private <T> T sendOnce(String operation, String method, String path, String payload, JavaType responseType) {
        String opName = service + "." + operation;
        HttpRequest.BodyPublisher publisher = payload == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(payload);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(policy.timeout())
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> resp;
        try {
            log.debug("{} {} {}", method, baseUrl + path, opName);
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DownstreamException.cancelled(service, opName + " interrupted", e);
        } catch (IOException e) {
            throw new DownstreamException(service, opName + " failed: " + e.getMessage(), e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new DownstreamException(service,
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                    resp.statusCode());
        }
        if (resp.body() == null || resp.body().isBlank()) {
            return null;
        }
        try {
            return json.readValue(resp.body(), responseType);
        } catch (JsonProcessingException e) {
            throw new DownstreamException(service, "Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DownstreamException(service, "JSON serialization failed for " + service, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("base URL must be configured");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
