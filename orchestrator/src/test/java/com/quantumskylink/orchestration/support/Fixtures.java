package com.quantumskylink.orchestration.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantumskylink.orchestration.catalog.WorkflowCatalog;
import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.model.WorkflowDefinition;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Shared test data. */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-10-18T10:00:00Z");

    private Fixtures() {}

    /** Mapper configured like the one Spring Boot provides. */
    public static ObjectMapper objectMapper() {
        return Jackson2ObjectMapperBuilder.json().build();
    }

    /** Catalog restricted to the given built-in workflows. */
    public static WorkflowCatalog catalogOf(String... ids) {
        Set<String> wanted = Set.of(ids);
        List<WorkflowDefinition> defs = WorkflowCatalogConfiguration.defaultDefinitions().stream()
                .filter(d -> wanted.contains(d.id()))
                .toList();
        return new WorkflowCatalog(defs);
    }

    public static WorkflowExecutionContext context(String workflowId, Map<String, Object> inputs) {
        return new WorkflowExecutionContext("exec-1", workflowId, inputs, Map.of(), "test", T0);
    }

    /** Anti-replay fields accepted by the signature gate, merged into {@code fields}. */
    public static Map<String, Object> signed(Map<String, Object> fields) {
        Map<String, Object> request = new HashMap<>(fields);
        request.put("nonce", "n-42");
        request.put("sequenceNumber", 7);
        request.put("timestamp", "2026-10-18T09:59:58Z");
        request.put("signature", "c2lnbmF0dXJl");
        request.put("algorithm", "Dilithium3");
        return request;
    }

    public static Map<String, Object> paymentRequest() {
        return signed(Map.of(
                "paymentId", "pay-1",
                "amount", 100,
                "fromAccountId", "acc-from",
                "toAccountId", "acc-to",
                "userId", "u1"));
    }
}
