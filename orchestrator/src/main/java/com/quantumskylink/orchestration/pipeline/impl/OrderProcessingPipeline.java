package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.MarketplaceClient;
import com.quantumskylink.orchestration.client.dto.ListingValidationRequest;
import com.quantumskylink.orchestration.client.dto.MarketplaceValidationResult;
import com.quantumskylink.orchestration.client.dto.OrderCreationRequest;
import com.quantumskylink.orchestration.client.dto.OrderCreationResult;
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
 * marketplace-order-processing:
 * Security Validation → Validate Listing → Create Order → Record Order.
 * The buyer signs.
 */
@Component
public class OrderProcessingPipeline implements WorkflowPipeline {

    static final String INPUT     = "orderRequest";
    static final String OPERATION = "order_processing";

    private final RequestBinder     binder;
    private final SignatureGate     signatureGate;
    private final MarketplaceClient marketplace;

    public OrderProcessingPipeline(RequestBinder binder, SignatureGate signatureGate,
                                   MarketplaceClient marketplace) {
        this.binder        = binder;
        this.signatureGate = signatureGate;
        this.marketplace   = marketplace;
    }

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.ORDER;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        OrderRequest request = binder.bindChecked(
                context.getInputs(), INPUT, OrderRequest.class, OrderProcessingPipeline::fieldErrors);

        Run run = new Run(request);
        return List.of(
                PipelineStep.fatal("Security Validation", run::validateSignature),
                PipelineStep.fatal("Validate Listing",    run::validateListing),
                PipelineStep.fatal("Create Order",        run::createOrder),
                PipelineStep.fatal("Record Order",        run::record));
    }

    @Override
    public List<String> validateRequest(Map<String, Object> inputs) {
        return binder.check(inputs, INPUT, OrderRequest.class, OrderProcessingPipeline::fieldErrors);
    }

    static List<String> fieldErrors(OrderRequest request) {
        List<String> errors = new ArrayList<>();
        RequestBinder.requireText(errors, request.listingId(), "listingId");
        RequestBinder.requireText(errors, request.buyerId(), "buyerId");
        return errors;
    }

    private final class Run {

        private final OrderRequest request;
        private String              signatureValidationId;
        private OrderCreationResult order;

        Run(OrderRequest request) {
            this.request = request;
        }

        StepResult validateSignature(WorkflowExecutionContext ctx) {
            SignatureCheck check = signatureGate.verifyRequest(
                    request, request.buyerId(), OPERATION, request.signedPayload());
            if (!check.passed()) {
                return check.toFailure();
            }
            signatureValidationId = check.validationId();
            return StepResult.ok();
        }

        StepResult validateListing(WorkflowExecutionContext ctx) {
            MarketplaceValidationResult availability = marketplace.validateListing(
                    request.listingId(), new ListingValidationRequest(request.buyerId(), request.quantity()));
            if (!availability.valid()) {
                return StepResult.rejected("Listing validation failed: " + availability.message());
            }
            return StepResult.ok();
        }

        StepResult createOrder(WorkflowExecutionContext ctx) {
            order = marketplace.createOrder(new OrderCreationRequest(
                    request.orderId(), request.listingId(), request.buyerId(), request.sellerId(),
                    request.quantity(), request.totalAmount(), request.escrowRequired(),
                    signatureValidationId));
            return StepResult.ok();
        }

        StepResult record(WorkflowExecutionContext ctx) {
            Map<String, Object> results = new LinkedHashMap<>();
            results.put("orderId", order.orderId());
            results.put("listingId", order.listingId() != null ? order.listingId() : request.listingId());
            results.put("signatureValidationId", signatureValidationId);
            return StepResult.ok(results);
        }
    }
}
