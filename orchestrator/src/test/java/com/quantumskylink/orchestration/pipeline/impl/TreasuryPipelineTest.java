package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.model.ExecutionStatus;
import com.quantumskylink.orchestration.service.ExecutionOutcome;
import com.quantumskylink.orchestration.service.ExecutionRequest;
import com.quantumskylink.orchestration.support.ExecutorHarness;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TreasuryPipelineTest {

    @Test
    void execute_acceptedOperation_succeedsWithSingleStep() {
        ExecutorHarness harness = new ExecutorHarness(new TreasuryPipeline());

        ExecutionOutcome outcome = harness.executor.execute(ExecutionRequest.of(
                WorkflowCatalogConfiguration.TREASURY,
                Map.of("treasuryOperation", Map.of("operationType", "rebalance")), "treasury-desk"));

        assertThat(outcome.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(harness.store.get(outcome.executionId()).orElseThrow().getHighlights())
                .singleElement()
                .satisfies(h -> assertThat(h.step()).isEqualTo("Treasury Operation"));
    }
}
