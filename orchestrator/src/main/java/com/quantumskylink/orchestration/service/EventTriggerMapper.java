package com.quantumskylink.orchestration.service;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Closed table from external event type to workflow id.
 * Unknown or null event types map to nothing.
 */
@Component
public class EventTriggerMapper {

    private record Route(String workflowId, String description) {}

    private static final Map<String, Route> ROUTES = Map.of(
            "payment_requested",
            new Route(WorkflowCatalogConfiguration.PAYMENT,
                    "Payment workflow triggered by external event"),
            "user_registration",
            new Route(WorkflowCatalogConfiguration.ONBOARDING,
                    "User onboarding workflow triggered by registration event"),
            "treasury_operation_requested",
            new Route(WorkflowCatalogConfiguration.TREASURY,
                    "Treasury workflow triggered by operation request"));

    public Optional<String> map(String eventType) {
        return route(eventType).map(Route::workflowId);
    }

    /**
     * Build the execution request for an event, if its type is mapped.
     * The event data becomes the input bag and the headers become the context.
     */
    public Optional<ExecutionRequest> toRequest(String eventType,
                                                String source,
                                                Map<String, Object> eventData,
                                                Map<String, String> headers) {
        return route(eventType).map(r -> new ExecutionRequest(
                r.workflowId(), eventData, source, headers, r.description(), null));
    }

    private static Optional<Route> route(String eventType) {
        return eventType == null ? Optional.empty() : Optional.ofNullable(ROUTES.get(eventType));
    }
}
