package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Client for the multisig wallet service used during onboarding.
 *
 * The four calls hand an open-ended artifact map from one stage to the
 * next, so bodies and responses stay untyped.
 */
@Component
public class MultisigClient {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ServiceHttpClient http;

    public MultisigClient(
            @Value("${skylink.services.multisig.base-url}") String baseUrl,
            @Value("${skylink.services.multisig.timeout:10s}") Duration timeout,
            @Value("${skylink.services.multisig.retries:1}") int retries,
            @Value("${skylink.services.retry-backoff:1s}") Duration backoff,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.http = new ServiceHttpClient("multisig", baseUrl,
                new CallPolicy(timeout, retries, backoff), objectMapper, meterRegistry);
    }

    /** Generate a wallet for the user. An empty map means nothing was produced. */
    public Map<String, Object> generate(String userId) {
        return orEmpty(http.post("generate", "/internal/multisig/generate", Map.of("userId", userId), MAP));
    }

    /** Persist generated artifacts; the response carries the storage key and etag. */
    public Map<String, Object> persist(Map<String, Object> artifacts) {
        return orEmpty(http.post("persist", "/internal/multisig/persist", artifacts, MAP));
    }

    public Map<String, Object> publish(Map<String, Object> artifacts) {
        return orEmpty(http.post("publish", "/internal/multisig/publish", artifacts, MAP));
    }

    /** Confirm the published artifact reached the ingest side. */
    public Map<String, Object> ingest(Map<String, Object> payload) {
        return orEmpty(http.post("ingest", "/internal/multisig/ingest", payload, MAP));
    }

    private static Map<String, Object> orEmpty(Map<String, Object> body) {
        return body == null ? Map.of() : body;
    }
}
