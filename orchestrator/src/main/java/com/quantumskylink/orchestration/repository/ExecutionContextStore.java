package com.quantumskylink.orchestration.repository;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-bound keyed store of execution state plus a secondary index
 * (e.g. user id → execution id).
 *
 * Only the pipeline run that owns an execution id writes it; reads may run
 * concurrently and see the latest completed write. Once an entry's TTL has
 * elapsed, lookups report it as absent.
 *
 * The in-process implementation serves a single instance; a scaled-out
 * deployment swaps in an external keyed store behind this interface.
 */
public interface ExecutionContextStore {

    void put(String executionId, WorkflowExecutionContext context, Duration ttl);

    Optional<WorkflowExecutionContext> get(String executionId);

    void putIndex(String secondaryKey, String executionId, Duration ttl);

    Optional<String> getByIndex(String secondaryKey);

    /**
     * Drop every expired entry.
     *
     * @return number of entries removed (contexts and index keys together)
     */
    int purgeExpired();
}
