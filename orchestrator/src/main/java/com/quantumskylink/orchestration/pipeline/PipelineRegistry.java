package com.quantumskylink.orchestration.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow id → pipeline lookup.
 *
 * Spring collects every {@link WorkflowPipeline} bean and passes the list
 * here. Adding a workflow only requires declaring its pipeline as
 * {@code @Component}.
 */
@Component
public class PipelineRegistry {

    private static final Logger log = LoggerFactory.getLogger(PipelineRegistry.class);

    private final Map<String, WorkflowPipeline> pipelines = new ConcurrentHashMap<>();

    public PipelineRegistry(List<WorkflowPipeline> allPipelines) {
        for (WorkflowPipeline pipeline : allPipelines) {
            WorkflowPipeline previous = pipelines.putIfAbsent(pipeline.workflowId(), pipeline);
            if (previous != null) {
                throw new IllegalStateException("Two pipelines registered for workflow '"
                        + pipeline.workflowId() + "': " + previous.getClass().getSimpleName()
                        + " and " + pipeline.getClass().getSimpleName());
            }
            log.info("Registered pipeline '{}' ({})",
                    pipeline.workflowId(), pipeline.getClass().getSimpleName());
        }
    }

    public Optional<WorkflowPipeline> find(String workflowId) {
        return Optional.ofNullable(pipelines.get(workflowId));
    }

    /** Returns all registered workflow ids (sorted). */
    public List<String> workflowIds() {
        return pipelines.keySet().stream().sorted().toList();
    }
}
