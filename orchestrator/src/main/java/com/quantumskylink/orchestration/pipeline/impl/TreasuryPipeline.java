package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.PipelineStep;
import com.quantumskylink.orchestration.pipeline.StepResult;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * treasury-operations-secure.
 *
 * Single no-op step. Signature-gated treasury steps are not defined yet.
 */
@Component
public class TreasuryPipeline implements WorkflowPipeline {

    private static final Logger log = LoggerFactory.getLogger(TreasuryPipeline.class);

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.TREASURY;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        return List.of(PipelineStep.fatal("Treasury Operation", ctx -> {
            log.info("Treasury workflow accepted for execution {}", ctx.getExecutionId());
            return StepResult.ok();
        }));
    }
}
