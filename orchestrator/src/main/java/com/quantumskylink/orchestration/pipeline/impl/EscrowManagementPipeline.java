package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.MarketplaceClient;
import com.quantumskylink.orchestration.client.dto.MarketplaceValidationResult;
import com.quantumskylink.orchestration.client.dto.OrderStatusUpdateRequest;
import com.quantumskylink.orchestration.client.dto.OrderStatusUpdateResult;
import com.quantumskylink.orchestration.client.dto.OrderVerificationRequest;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.PipelineStep;
import com.quantumskylink.orchestration.pipeline.RequestBinder;
import com.quantumskylink.orchestration.pipeline.SignatureCheck;
import com.quantumskylink.orchestration.pipeline.SignatureGate;
import com.quantumskylink.orchestration.pipeline.StepResult;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * marketplace-escrow-management:
 * Security Validation → Verify Order → Update Order Status → Record Escrow.
 *
 * A release is signed by the seller and completes the order; any other
 * action is signed by the buyer and cancels it.
 */
@Component
public class EscrowManagementPipeline implements WorkflowPipeline {

    static final String INPUT     = "escrowRequest";
    static final String OPERATION = "escrow_management";

    static final String STATUS_COMPLETED = "Completed";
    static final String STATUS_CANCELLED = "Cancelled";

    private final RequestBinder     binder;
    private final SignatureGate     signatureGate;
    private final MarketplaceClient marketplace;

    public EscrowManagementPipeline(RequestBinder binder, SignatureGate signatureGate,
                                    MarketplaceClient marketplace) {
        this.binder        = binder;
        this.signatureGate = signatureGate;
        this.marketplace   = marketplace;
    }

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.ESCROW;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        EscrowRequest request = binder.bindChecked(
                context.getInputs(), INPUT, EscrowRequest.class, EscrowManagementPipeline::fieldErrors);

        Run run = new Run(request);
        return List.of(
                PipelineStep.fatal("Security Validation", run::validateSignature),
                PipelineStep.fatal("Verify Order",        run::verifyOrder),
                PipelineStep.fatal("Update Order Status", run::updateStatus),
                PipelineStep.fatal("Record Escrow",       run::record));
    }

    @Override
    public List<String> validateRequest(Map<String, Object> inputs) {
        return binder.check(inputs, INPUT, EscrowRequest.class, EscrowManagementPipeline::fieldErrors);
    }

    static List<String> fieldErrors(EscrowRequest request) {
        List<String> errors = new ArrayList<>();
        RequestBinder.requireText(errors, request.orderId(), "orderId");
        RequestBinder.requireText(errors, request.action(), "action");
        RequestBinder.requireText(errors, request.signerId(), request.isRelease() ? "sellerId" : "buyerId");
        return errors;
    }

    private final class Run {

        private final EscrowRequest request;
        private String                  signatureValidationId;
        private OrderStatusUpdateResult update;

        Run(EscrowRequest request) {
            this.request = request;
        }

        StepResult validateSignature(WorkflowExecutionContext ctx) {
            SignatureCheck check = signatureGate.verifyRequest(
                    request, request.signerId(), OPERATION, request.signedPayload());
            if (!check.passed()) {
                return check.toFailure();
            }
            signatureValidationId = check.validationId();
            return StepResult.ok();
        }

        StepResult verifyOrder(WorkflowExecutionContext ctx) {
            MarketplaceValidationResult verification = marketplace.verifyOrder(request.orderId(),
                    new OrderVerificationRequest(request.escrowId(), request.action(), request.signerId()));
            if (!verification.valid()) {
                return StepResult.rejected("Order verification failed: " + verification.message());
            }
            return StepResult.ok();
        }

        StepResult updateStatus(WorkflowExecutionContext ctx) {
            String target = request.isRelease() ? STATUS_COMPLETED : STATUS_CANCELLED;
            update = marketplace.updateOrderStatus(request.orderId(),
                    new OrderStatusUpdateRequest(target, request.reason(), signatureValidationId));
            return StepResult.ok();
        }

        StepResult record(WorkflowExecutionContext ctx) {
            Map<String, Object> results = new LinkedHashMap<>();
            results.put("escrowId", request.escrowId());
            results.put("orderId", request.orderId());
            results.put("action", request.action());
            results.put("orderStatus", update.status());
            results.put("signatureValidationId", signatureValidationId);
            return StepResult.ok(results);
        }
    }
}
