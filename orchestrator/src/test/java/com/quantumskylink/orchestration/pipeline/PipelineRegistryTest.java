package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineRegistryTest {

    private static WorkflowPipeline named(String id) {
        return new WorkflowPipeline() {
            @Override public String workflowId() { return id; }
            @Override public List<PipelineStep> plan(WorkflowExecutionContext context) { return List.of(); }
        };
    }

    @Test
    void find_registeredAndUnknownIds() {
        WorkflowPipeline b = named("b");
        PipelineRegistry registry = new PipelineRegistry(List.of(b, named("a")));

        assertThat(registry.find("b")).contains(b);
        assertThat(registry.find("zzz")).isEmpty();
        assertThat(registry.workflowIds()).containsExactly("a", "b");
    }

    @Test
    void constructor_duplicateWorkflowId_throws() {
        assertThatThrownBy(() -> new PipelineRegistry(List.of(named("a"), named("a"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'a'");
    }
}
