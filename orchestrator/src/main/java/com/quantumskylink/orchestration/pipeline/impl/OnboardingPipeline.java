package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.MultisigClient;
import com.quantumskylink.orchestration.client.UserServiceClient;
import com.quantumskylink.orchestration.client.dto.UserProfile;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.CompletionEvent;
import com.quantumskylink.orchestration.pipeline.PipelineStep;
import com.quantumskylink.orchestration.pipeline.RequestBinder;
import com.quantumskylink.orchestration.pipeline.StepResult;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * user-onboarding-optimized.
 *
 * <pre>
 *   Fetch User Profile (best-effort) → Generate Multisig → Persist Artifacts
 *     → Publish Artifacts → Confirm Publication (best-effort) → Record Onboarding
 * </pre>
 *
 * The user id is indexed at dispatch time under {@code onboarding_user_<userId>}
 * so a caller can poll by user id instead of execution id.
 */
@Component
public class OnboardingPipeline implements WorkflowPipeline {

    private static final Logger log = LoggerFactory.getLogger(OnboardingPipeline.class);

    static final String INPUT            = "userRegistration";
    static final String INDEX_PREFIX     = "onboarding_user_";
    static final String COMPLETION_EVENT = "onboarding_completed";

    private final RequestBinder     binder;
    private final UserServiceClient users;
    private final MultisigClient    multisig;

    public OnboardingPipeline(RequestBinder binder, UserServiceClient users, MultisigClient multisig) {
        this.binder   = binder;
        this.users    = users;
        this.multisig = multisig;
    }

    /** Secondary-index key for a user's latest onboarding execution. */
    public static String indexKey(String userId) {
        return INDEX_PREFIX + userId;
    }

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.ONBOARDING;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        UserRegistration registration = binder.bindChecked(
                context.getInputs(), INPUT, UserRegistration.class, OnboardingPipeline::fieldErrors);
        String userId = registration.userId();
        log.info("Planning onboarding for user {} (execution {})", userId, context.getExecutionId());

        Run run = new Run(userId);
        return List.of(
                PipelineStep.bestEffort("Fetch User Profile",   run::fetchProfile),
                PipelineStep.fatal("Generate Multisig",         run::generate),
                PipelineStep.fatal("Persist Artifacts",         run::persist),
                PipelineStep.fatal("Publish Artifacts",         run::publish),
                PipelineStep.bestEffort("Confirm Publication",  run::confirm),
                PipelineStep.fatal("Record Onboarding",         run::record));
    }

    @Override
    public Optional<String> secondaryKey(Map<String, Object> inputs) {
        if (inputs.get(INPUT) instanceof Map<?, ?> registration
                && registration.get("userId") instanceof String userId
                && !userId.isBlank()) {
            return Optional.of(indexKey(userId));
        }
        return Optional.empty();
    }

    @Override
    public Optional<CompletionEvent> completionEvent(WorkflowExecutionContext finished) {
        Map<String, Object> results = finished.getResults();

        Map<String, Object> wallet = new LinkedHashMap<>();
        wallet.put("id", results.get("multisigId"));
        wallet.put("chainId", results.get("chainId"));
        wallet.put("address", results.get("address"));

        Map<String, Object> storage = new LinkedHashMap<>();
        storage.put("key", results.get("s3Key"));
        storage.put("etag", results.get("s3Etag"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", results.get("userId"));
        data.put("multisig", wallet);
        data.put("s3", storage);
        return Optional.of(new CompletionEvent(COMPLETION_EVENT, data));
    }

    @Override
    public List<String> validateRequest(Map<String, Object> inputs) {
        return binder.check(inputs, INPUT, UserRegistration.class, OnboardingPipeline::fieldErrors);
    }

    static List<String> fieldErrors(UserRegistration request) {
        List<String> errors = new ArrayList<>();
        RequestBinder.requireText(errors, request.userId(), "userId");
        return errors;
    }

    private final class Run {

        private final String        userId;
        private Map<String, Object> artifacts = Map.of();
        private Map<String, Object> persisted = Map.of();
        private Map<String, Object> published = Map.of();

        Run(String userId) {
            this.userId = userId;
        }

        StepResult fetchProfile(WorkflowExecutionContext ctx) {
            UserProfile profile = users.getUser(userId);
            if (profile == null) {
                return StepResult.rejected("User profile not found for " + userId);
            }
            log.info("Fetched user profile for {}", userId);
            return StepResult.ok();
        }

        StepResult generate(WorkflowExecutionContext ctx) {
            artifacts = multisig.generate(userId);
            if (artifacts.isEmpty()) {
                return StepResult.rejected("Multisig artifacts generation returned empty result");
            }
            log.info("Generated multisig artifacts for user {}", userId);
            return StepResult.ok();
        }

        StepResult persist(WorkflowExecutionContext ctx) {
            persisted = multisig.persist(artifacts);
            log.info("Persisted multisig artifacts for user {}", userId);
            return StepResult.ok();
        }

        StepResult publish(WorkflowExecutionContext ctx) {
            published = multisig.publish(artifacts);
            log.info("Published multisig artifacts to object storage for user {}", userId);
            return StepResult.ok();
        }

        StepResult confirm(WorkflowExecutionContext ctx) {
            Map<String, Object> payload = new LinkedHashMap<>();
            if (published.get("key") != null) payload.put("key", published.get("key"));
            if (published.get("idempotencyKey") != null) payload.put("idempotencyKey", published.get("idempotencyKey"));
            if (payload.isEmpty()) {
                return StepResult.rejected("Publication returned no object key to confirm");
            }
            multisig.ingest(payload);
            log.info("Confirmed published multisig object for user {}", userId);
            return StepResult.ok(Map.of("ingestConfirmed", true));
        }

        StepResult record(WorkflowExecutionContext ctx) {
            Map<String, Object> results = new LinkedHashMap<>();
            results.put("multisigId", persisted.get("id"));
            results.put("chainId", persisted.get("chainId"));
            results.put("address", persisted.get("address"));
            results.put("s3Key", published.get("key"));
            results.put("s3Etag", published.get("etag"));
            results.put("userId", userId);
            results.put("operationId", ctx.getExecutionId());
            return StepResult.ok(results);
        }
    }
}
