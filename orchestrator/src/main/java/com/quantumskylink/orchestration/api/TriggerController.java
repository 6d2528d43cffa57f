package com.quantumskylink.orchestration.api;

import com.quantumskylink.orchestration.api.dto.EventTriggerRequest;
import com.quantumskylink.orchestration.api.dto.EventTriggerResponse;
import com.quantumskylink.orchestration.service.EventTriggerMapper;
import com.quantumskylink.orchestration.service.ExecutionOutcome;
import com.quantumskylink.orchestration.service.ExecutionRequest;
import com.quantumskylink.orchestration.service.WorkflowExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * POST /api/orchestration/triggers/event - start a workflow from an external event.
 *
 * Mapped event types run exactly one execution and answer TRIGGERED with its
 * id, whatever its terminal status. Unmapped types answer IGNORED and create
 * nothing.
 */
@RestController
@RequestMapping("/api/orchestration/triggers")
public class TriggerController {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    private final EventTriggerMapper mapper;
    private final WorkflowExecutor   executor;

    public TriggerController(EventTriggerMapper mapper, WorkflowExecutor executor) {
        this.mapper   = mapper;
        this.executor = executor;
    }

    @PostMapping("/event")
    public EventTriggerResponse trigger(@RequestBody EventTriggerRequest req) {
        log.info("Processing event trigger: {}, source: {}", req.eventType(), req.source());
        Optional<ExecutionRequest> mapped =
                mapper.toRequest(req.eventType(), req.source(), req.eventData(), req.headers());
        if (mapped.isEmpty()) {
            log.info("No workflow mapped for event type {}", req.eventType());
            return EventTriggerResponse.ignored(req.eventType());
        }
        ExecutionOutcome outcome = executor.execute(mapped.get());
        return EventTriggerResponse.triggered(outcome.executionId(),
                "Workflow " + outcome.workflowId() + " finished with status " + outcome.status());
    }
}
