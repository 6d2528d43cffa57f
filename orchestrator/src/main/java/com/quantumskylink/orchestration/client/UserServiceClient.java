package com.quantumskylink.orchestration.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.client.dto.UserProfile;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Read-only client for user profiles. */
@Component
public class UserServiceClient {

    private final ServiceHttpClient http;

    public UserServiceClient(
            @Value("${skylink.services.user.base-url}") String baseUrl,
            @Value("${skylink.services.user.timeout:10s}") Duration timeout,
            @Value("${skylink.services.user.retries:2}") int retries,
            @Value("${skylink.services.retry-backoff:1s}") Duration backoff,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.http = new ServiceHttpClient("user-service", baseUrl,
                new CallPolicy(timeout, retries, backoff), objectMapper, meterRegistry);
    }

    public UserProfile getUser(String userId) {
        return http.get("getUser", "/api/users/" + URLEncoder.encode(userId, StandardCharsets.UTF_8),
                UserProfile.class);
    }
}
