package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.client.dto.ResultSignatureValidationRequest;
import com.quantumskylink.orchestration.client.dto.SignatureValidationRequest;
import com.quantumskylink.orchestration.client.dto.SignatureValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Client for the signature verification service.
 *
 * Signature checks sit on the hot path of every signed workflow, so the
 * default policy is a 1s deadline and no retries. A slow verifier fails
 * the workflow instead of stalling it.
 */
@Component
public class SignatureServiceClient {

    private static final Logger log = LoggerFactory.getLogger(SignatureServiceClient.class);

    private final ServiceHttpClient http;

    public SignatureServiceClient(
            @Value("${skylink.services.signature.base-url}") String baseUrl,
            @Value("${skylink.services.signature.timeout:1s}") Duration timeout,
            @Value("${skylink.services.signature.retries:0}") int retries,
            @Value("${skylink.services.retry-backoff:1s}") Duration backoff,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.http = new ServiceHttpClient("signature-service", baseUrl,
                new CallPolicy(timeout, retries, backoff), objectMapper, meterRegistry);
    }

    /** Verify a client-signed request. Never returns null. */
    public SignatureValidationResult validateRequest(SignatureValidationRequest request) {
        log.debug("Validating signature for account {} operation {}", request.accountId(), request.operation());
        return requireBody(http.post("validateRequest", "/api/signatures/validate",
                request, SignatureValidationResult.class), "validateRequest");
    }

    /** Verify that a downstream result carries the expected service signature. */
    public SignatureValidationResult validateResult(ResultSignatureValidationRequest request) {
        log.debug("Validating result signature from {}", request.signingService());
        return requireBody(http.post("validateResult", "/api/signatures/validate-result",
                request, SignatureValidationResult.class), "validateResult");
    }

    private SignatureValidationResult requireBody(SignatureValidationResult result, String op) {
        if (result == null) {
            throw new DownstreamException(http.getService(), op + " returned an empty body", 502);
        }
        return result;
    }
}
