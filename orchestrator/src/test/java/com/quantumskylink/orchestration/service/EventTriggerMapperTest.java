package com.quantumskylink.orchestration.service;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventTriggerMapperTest {

    private final EventTriggerMapper mapper = new EventTriggerMapper();

    @Test
    void map_knownEventTypes() {
        assertThat(mapper.map("payment_requested")).contains(WorkflowCatalogConfiguration.PAYMENT);
        assertThat(mapper.map("user_registration")).contains(WorkflowCatalogConfiguration.ONBOARDING);
        assertThat(mapper.map("treasury_operation_requested")).contains(WorkflowCatalogConfiguration.TREASURY);
    }

    @Test
    void map_unknownOrNullEventType_isEmpty() {
        assertThat(mapper.map("unknown_event")).isEmpty();
        assertThat(mapper.map("PAYMENT_REQUESTED")).isEmpty();
        assertThat(mapper.map(null)).isEmpty();
    }

    @Test
    void toRequest_carriesEventDataAsInputsAndHeadersAsContext() {
        Map<String, Object> data = Map.of("userRegistration", Map.of("userId", "u1"));

        ExecutionRequest request = mapper.toRequest("user_registration", "identity-service",
                data, Map.of("x-correlation-id", "c-1")).orElseThrow();

        assertThat(request.workflowId()).isEqualTo(WorkflowCatalogConfiguration.ONBOARDING);
        assertThat(request.inputs()).isEqualTo(data);
        assertThat(request.triggeredBy()).isEqualTo("identity-service");
        assertThat(request.context()).containsEntry("x-correlation-id", "c-1");
        assertThat(request.description()).isNotBlank();
        assertThat(request.priority()).isEqualTo(ExecutionRequest.DEFAULT_PRIORITY);
    }

    @Test
    void toRequest_nullDataAndHeaders_areEmpty() {
        ExecutionRequest request = mapper.toRequest("payment_requested", "external", null, null).orElseThrow();

        assertThat(request.inputs()).isEmpty();
        assertThat(request.context()).isEmpty();
    }

    @Test
    void toRequest_unmappedType_isEmpty() {
        assertThat(mapper.toRequest("unknown_event", "external", Map.of(), Map.of())).isEmpty();
    }
}
