package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.client.dto.PaymentProcessingRequest;
import com.quantumskylink.orchestration.client.dto.PaymentProcessingResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Client for the payment gateway. */
@Component
public class PaymentGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayClient.class);

    private final ServiceHttpClient http;

    public PaymentGatewayClient(
            @Value("${skylink.services.payment.base-url}") String baseUrl,
            @Value("${skylink.services.payment.timeout:5s}") Duration timeout,
            @Value("${skylink.services.payment.retries:2}") int retries,
            @Value("${skylink.services.retry-backoff:1s}") Duration backoff,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.http = new ServiceHttpClient("payment-gateway", baseUrl,
                new CallPolicy(timeout, retries, backoff), objectMapper, meterRegistry);
    }

    public PaymentProcessingResult processPayment(PaymentProcessingRequest request) {
        log.info("Submitting payment {} to gateway", request.paymentId());
        PaymentProcessingResult result = http.post("processPayment", "/api/payments/process",
                request, PaymentProcessingResult.class);
        if (result == null) {
            throw new DownstreamException(http.getService(), "processPayment returned an empty body", 502);
        }
        return result;
    }
}
