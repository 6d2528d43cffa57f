package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.MarketplaceClient;
import com.quantumskylink.orchestration.client.dto.ListingCreationRequest;
import com.quantumskylink.orchestration.client.dto.ListingCreationResult;
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
 * marketplace-listing-creation: Security Validation → Create Listing → Record Listing.
 * The seller signs.
 */
@Component
public class ListingCreationPipeline implements WorkflowPipeline {

    static final String INPUT     = "listingRequest";
    static final String OPERATION = "listing_creation";

    private final RequestBinder     binder;
    private final SignatureGate     signatureGate;
    private final MarketplaceClient marketplace;

    public ListingCreationPipeline(RequestBinder binder, SignatureGate signatureGate,
                                   MarketplaceClient marketplace) {
        this.binder        = binder;
        this.signatureGate = signatureGate;
        this.marketplace   = marketplace;
    }

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.LISTING;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        ListingRequest request = binder.bindChecked(
                context.getInputs(), INPUT, ListingRequest.class, ListingCreationPipeline::fieldErrors);

        Run run = new Run(request);
        return List.of(
                PipelineStep.fatal("Security Validation", run::validateSignature),
                PipelineStep.fatal("Create Listing",      run::createListing),
                PipelineStep.fatal("Record Listing",      run::record));
    }

    @Override
    public List<String> validateRequest(Map<String, Object> inputs) {
        return binder.check(inputs, INPUT, ListingRequest.class, ListingCreationPipeline::fieldErrors);
    }

    static List<String> fieldErrors(ListingRequest request) {
        List<String> errors = new ArrayList<>();
        RequestBinder.requireText(errors, request.sellerId(), "sellerId");
        RequestBinder.requireText(errors, request.tokenId(), "tokenId");
        return errors;
    }

    private final class Run {

        private final ListingRequest request;
        private String                signatureValidationId;
        private ListingCreationResult listing;

        Run(ListingRequest request) {
            this.request = request;
        }

        StepResult validateSignature(WorkflowExecutionContext ctx) {
            SignatureCheck check = signatureGate.verifyRequest(
                    request, request.sellerId(), OPERATION, request.signedPayload());
            if (!check.passed()) {
                return check.toFailure();
            }
            signatureValidationId = check.validationId();
            return StepResult.ok();
        }

        StepResult createListing(WorkflowExecutionContext ctx) {
            listing = marketplace.createListing(new ListingCreationRequest(
                    request.listingId(), request.tokenId(), request.sellerId(), request.quantity(),
                    request.basePrice(), request.pricingModel(), request.listingType(),
                    signatureValidationId));
            return StepResult.ok();
        }

        StepResult record(WorkflowExecutionContext ctx) {
            Map<String, Object> results = new LinkedHashMap<>();
            results.put("listingId", listing.listingId());
            results.put("tokenId", listing.tokenId() != null ? listing.tokenId() : request.tokenId());
            results.put("signatureValidationId", signatureValidationId);
            return StepResult.ok(results);
        }
    }
}
