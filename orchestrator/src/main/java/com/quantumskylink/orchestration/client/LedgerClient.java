package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.client.dto.LedgerValidationRequest;
import com.quantumskylink.orchestration.client.dto.LedgerValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Client for the ledger hub's pre-transaction validation. */
@Component
public class LedgerClient {

    private final ServiceHttpClient http;

    public LedgerClient(
            @Value("${skylink.services.ledger.base-url}") String baseUrl,
            @Value("${skylink.services.ledger.timeout:3s}") Duration timeout,
            @Value("${skylink.services.ledger.retries:2}") int retries,
            @Value("${skylink.services.retry-backoff:1s}") Duration backoff,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.http = new ServiceHttpClient("ledger", baseUrl,
                new CallPolicy(timeout, retries, backoff), objectMapper, meterRegistry);
    }

    public LedgerValidationResult validateTransaction(LedgerValidationRequest request) {
        LedgerValidationResult result = http.post("validateTransaction",
                "/api/ledger/transactions/validate", request, LedgerValidationResult.class);
        if (result == null) {
            throw new DownstreamException(http.getService(), "validateTransaction returned an empty body", 502);
        }
        return result;
    }
}
