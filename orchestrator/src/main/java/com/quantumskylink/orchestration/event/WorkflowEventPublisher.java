package com.quantumskylink.orchestration.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Fire-and-forget delivery of workflow lifecycle events.
 *
 * Each event is wrapped in an envelope and POSTed asynchronously to
 * {@code <base-url>/topics/<topic>}:
 * <pre>
 *   workflow-events   started / completed / failed and domain completion events
 *   workflow-status   per-step status updates
 *   workflow-errors   error details
 *   admin-alerts      infrastructure faults
 * </pre>
 *
 * No method throws. Delivery failures are logged at WARN and dropped, so
 * an event sink outage never changes a workflow's outcome. A blank base URL
 * disables delivery.
 */
@Component
public class WorkflowEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventPublisher.class);

    static final String TOPIC_EVENTS = "workflow-events";
    static final String TOPIC_STATUS = "workflow-status";
    static final String TOPIC_ERRORS = "workflow-errors";
    static final String TOPIC_ALERTS = "admin-alerts";

    static final String SOURCE  = "OrchestrationService";
    static final String VERSION = "1.0";

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "signature", "validationid", "privatekey", "secret", "token",
            "password", "apikey", "internalid", "systemid");

    private static final List<Pattern> SENSITIVE_PATTERNS = List.of(
            Pattern.compile("signature:\\s*[A-Za-z0-9+/=]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("token:\\s*[A-Za-z0-9\\-_]+",    Pattern.CASE_INSENSITIVE),
            Pattern.compile("key:\\s*[A-Za-z0-9+/=]+",       Pattern.CASE_INSENSITIVE),
            Pattern.compile("password:\\s*\\S+",             Pattern.CASE_INSENSITIVE),
            Pattern.compile("secret:\\s*\\S+",               Pattern.CASE_INSENSITIVE));

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Clock        clock;
    private final String       baseUrl;

    public WorkflowEventPublisher(
            @Value("${skylink.events.base-url:}") String baseUrl,
            ObjectMapper objectMapper,
            Clock clock) {
        this.baseUrl = baseUrl == null || baseUrl.isBlank()
                ? null
                : (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
        this.json    = objectMapper;
        this.clock   = clock;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        if (this.baseUrl == null) {
            log.warn("skylink.events.base-url is not set; workflow events will be dropped");
        }
    }

    // ------------------------------------------------------------------
    // Event families
    // ------------------------------------------------------------------

    /** Publish a lifecycle or domain event to {@code workflow-events}. */
    public void publish(String workflowId, String executionId, String eventType, Map<String, ?> data) {
        send(TOPIC_EVENTS, workflowId, executionId, eventType, data);
    }

    public void publishStatusUpdate(String workflowId, String executionId,
                                    String status, int progress, String currentStep) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        data.put("progress", progress);
        data.put("currentStep", currentStep);
        data.put("timestamp", clock.instant().toString());
        send(TOPIC_STATUS, workflowId, executionId, "workflow_status_update", data);
    }

    public void publishCompletion(String workflowId, String executionId,
                                  Duration duration, Map<String, ?> results) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "SUCCESS");
        data.put("duration", duration.toMillis() / 1000.0);
        data.put("results", results);
        data.put("completedAt", clock.instant().toString());
        send(TOPIC_EVENTS, workflowId, executionId, "workflow_completed", data);
    }

    public void publishError(String workflowId, String executionId, FailureKind kind, String errorMessage) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorType", kind.name());
        data.put("errorMessage", redact(errorMessage));
        data.put("timestamp", clock.instant().toString());
        send(TOPIC_ERRORS, workflowId, executionId, "workflow_error", data);
    }

    public void publishAdminAlert(String alertType, String message, String workflowId, String executionId) {
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("alertType", alertType);
        alert.put("message", redact(message));
        alert.put("workflowType", workflowId);
        alert.put("executionId", executionId);
        alert.put("timestamp", clock.instant().toString());
        alert.put("service", SOURCE);
        deliver(TOPIC_ALERTS, alert, alertType);
    }

    // ------------------------------------------------------------------
    // Envelope and delivery
    // ------------------------------------------------------------------

    Map<String, Object> envelope(String workflowId, String executionId, String eventType, Map<String, ?> data) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "workflow_event");
        message.put("workflowType", workflowId);
        message.put("executionId", executionId);
        message.put("eventType", eventType);
        message.put("timestamp", clock.instant().toString());
        message.put("data", sanitize(data));
        message.put("source", SOURCE);
        message.put("version", VERSION);
        return message;
    }

    private void send(String topic, String workflowId, String executionId, String eventType, Map<String, ?> data) {
        try {
            deliver(topic, envelope(workflowId, executionId, eventType, data), eventType);
        } catch (RuntimeException e) {
            log.warn("Failed to build {} event for execution {}: {}", eventType, executionId, e.getMessage());
        }
    }

    /**
     * POST {@code body} to the topic without waiting for the answer.
     *
     * @return completes once delivery has been attempted; never completes exceptionally
     */
    CompletableFuture<Void> deliver(String topic, Map<String, Object> body, String label) {
        if (baseUrl == null) {
            log.debug("Dropping {} event: no event sink configured", label);
            return CompletableFuture.completedFuture(null);
        }
        String payload;
        try {
            payload = json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} event: {}", label, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/topics/" + topic))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        return http.sendAsync(req, HttpResponse.BodyHandlers.discarding())
                .handle((resp, err) -> {
                    if (err != null) {
                        log.warn("Failed to publish {} event to {}: {}", label, topic, err.getMessage());
                    } else if (resp.statusCode() >= 300) {
                        log.warn("Event sink rejected {} event on {}: HTTP {}", label, topic, resp.statusCode());
                    } else {
                        log.debug("Published {} event to {}", label, topic);
                    }
                    return null;
                });
    }

    // ------------------------------------------------------------------
    // Sanitization
    // ------------------------------------------------------------------

    /** Copy of {@code data} without sensitive keys, at any depth. Key match ignores case. */
    static Map<String, Object> sanitize(Map<String, ?> data) {
        Map<String, Object> clean = new LinkedHashMap<>();
        if (data == null) {
            return clean;
        }
        data.forEach((key, value) -> {
            if (SENSITIVE_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                return;
            }
            clean.put(key, sanitizeValue(value));
        });
        return clean;
    }

    @SuppressWarnings("unchecked")
    private static Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return sanitize((Map<String, ?>) nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(WorkflowEventPublisher::sanitizeValue).toList();
        }
        return value;
    }

    /** Mask credential-looking fragments in free text. */
    public static String redact(String message) {
        if (message == null) {
            return null;
        }
        String result = message;
        for (Pattern pattern : SENSITIVE_PATTERNS) {
            result = pattern.matcher(result).replaceAll("[REDACTED]");
        }
        return result;
    }
}
