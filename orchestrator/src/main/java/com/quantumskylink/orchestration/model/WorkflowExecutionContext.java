package com.quantumskylink.orchestration.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one workflow execution.
 *
 * Created by the executor with status RUNNING, then mutated only by the
 * pipeline run that owns its execution id. The context store keeps copies
 * (see {@link #copy()}), so a reader never observes a half-applied step.
 */
public class WorkflowExecutionContext {

    private final String              executionId;
    private final String              workflowId;
    private final Map<String, Object> inputs;
    private final Map<String, String> metadata;
    private final String              triggeredBy;
    private final Instant             startedAt;

    private Instant          completedAt;
    private ExecutionStatus  status = ExecutionStatus.RUNNING;
    private FailureKind      failureKind;
    private String           errorMessage;
    private String           currentStep;
    private int              totalSteps;
    private int              completedSteps;

    private final Map<String, Object>     results    = new LinkedHashMap<>();
    private final List<WorkflowHighlight> highlights = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public WorkflowExecutionContext(String executionId,
                                    String workflowId,
                                    Map<String, Object> inputs,
                                    Map<String, String> metadata,
                                    String triggeredBy,
                                    Instant startedAt) {
        this.executionId = executionId;
        this.workflowId  = workflowId;
        this.inputs      = inputs   == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.metadata    = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.triggeredBy = triggeredBy;
        this.startedAt   = startedAt;
    }

    /** Deep enough copy for the store: collections are duplicated, values shared. */
    public WorkflowExecutionContext copy() {
        WorkflowExecutionContext c = new WorkflowExecutionContext(
                executionId, workflowId, inputs, metadata, triggeredBy, startedAt);
        c.completedAt    = completedAt;
        c.status         = status;
        c.failureKind    = failureKind;
        c.errorMessage   = errorMessage;
        c.currentStep    = currentStep;
        c.totalSteps     = totalSteps;
        c.completedSteps = completedSteps;
        c.results.putAll(results);
        c.highlights.addAll(highlights);
        return c;
    }

    // ------------------------------------------------------------------
    // Step bookkeeping
    // ------------------------------------------------------------------

    public void beginStep(String step, Instant at) {
        requireRunning();
        this.currentStep = step;
        highlights.add(WorkflowHighlight.started(step, at));
    }

    /**
     * Close the step opened by {@link #beginStep}. SUCCESS and SKIPPED both
     * count towards progress; FAILED does not.
     */
    public void finishStep(HighlightStatus outcome, Instant at, String message) {
        requireRunning();
        if (highlights.isEmpty()) {
            throw new IllegalStateException("No step in progress for execution " + executionId);
        }
        int last = highlights.size() - 1;
        highlights.set(last, highlights.get(last).finish(outcome, at, message));
        if (outcome == HighlightStatus.SUCCESS || outcome == HighlightStatus.SKIPPED) {
            completedSteps++;
        }
    }

    public void mergeResults(Map<String, ?> values) {
        requireRunning();
        values.forEach((k, v) -> {
            if (v != null) results.put(k, v);
        });
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    public void markSucceeded(Instant at) {
        requireRunning();
        this.status      = ExecutionStatus.SUCCESS;
        this.completedAt = at;
        this.currentStep = null;
    }

    public void markFailed(FailureKind kind, String message, Instant at) {
        requireRunning();
        this.status       = ExecutionStatus.FAILED;
        this.failureKind  = kind;
        this.errorMessage = message;
        this.completedAt  = at;
    }

    private void requireRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution " + executionId + " is already " + status);
        }
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    /**
     * Percentage of steps finished, 0..100.
     *
     * 100 is reserved for SUCCESS; a running or failed execution tops out at 99.
     * Step counts only grow, so the value never decreases over an execution.
     */
    public int progressPercent() {
        if (status == ExecutionStatus.SUCCESS) {
            return 100;
        }
        if (totalSteps <= 0) {
            return 0;
        }
        return Math.min(99, completedSteps * 100 / totalSteps);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String              getExecutionId()    { return executionId; }
    public String              getWorkflowId()     { return workflowId; }
    public Map<String, Object> getInputs()         { return inputs; }
    public Map<String, String> getMetadata()       { return metadata; }
    public String              getTriggeredBy()    { return triggeredBy; }
    public Instant             getStartedAt()      { return startedAt; }
    public Instant             getCompletedAt()    { return completedAt; }
    public ExecutionStatus     getStatus()         { return status; }
    public FailureKind         getFailureKind()    { return failureKind; }
    public String              getErrorMessage()   { return errorMessage; }
    public String              getCurrentStep()    { return currentStep; }
    public int                 getTotalSteps()     { return totalSteps; }
    public int                 getCompletedSteps() { return completedSteps; }

    public Map<String, Object>     getResults()    { return Collections.unmodifiableMap(results); }
    public List<WorkflowHighlight> getHighlights() { return Collections.unmodifiableList(highlights); }

    public void setTotalSteps(int totalSteps)      { this.totalSteps = totalSteps; }
}
