package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.LedgerClient;
import com.quantumskylink.orchestration.client.PaymentGatewayClient;
import com.quantumskylink.orchestration.client.dto.LedgerValidationRequest;
import com.quantumskylink.orchestration.client.dto.LedgerValidationResult;
import com.quantumskylink.orchestration.client.dto.PaymentProcessingRequest;
import com.quantumskylink.orchestration.client.dto.PaymentProcessingResult;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.PipelineStep;
import com.quantumskylink.orchestration.pipeline.RequestBinder;
import com.quantumskylink.orchestration.pipeline.SignatureCheck;
import com.quantumskylink.orchestration.pipeline.SignatureGate;
import com.quantumskylink.orchestration.pipeline.StepResult;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * payment-processing-zero-trust.
 *
 * <pre>
 *   Security Validation → Ledger Validation → Payment Processing
 *     → Result Signature Validation → Record Payment
 * </pre>
 *
 * The gateway's result is trusted only after its signature has been
 * checked against the original request validation.
 */
@Component
public class PaymentPipeline implements WorkflowPipeline {

    private static final Logger log = LoggerFactory.getLogger(PaymentPipeline.class);

    static final String INPUT           = "paymentRequest";
    static final String OPERATION       = "payment";
    static final String SIGNING_SERVICE = "PaymentGatewayService";

    private final RequestBinder        binder;
    private final SignatureGate        signatureGate;
    private final LedgerClient         ledger;
    private final PaymentGatewayClient gateway;

    public PaymentPipeline(RequestBinder binder,
                           SignatureGate signatureGate,
                           LedgerClient ledger,
                           PaymentGatewayClient gateway) {
        this.binder        = binder;
        this.signatureGate = signatureGate;
        this.ledger        = ledger;
        this.gateway       = gateway;
    }

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.PAYMENT;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        PaymentRequest request = binder.bindChecked(
                context.getInputs(), INPUT, PaymentRequest.class, PaymentPipeline::fieldErrors);
        log.info("Planning payment {} of {} for execution {}",
                request.paymentId(), request.amount(), context.getExecutionId());

        Run run = new Run(request);
        return List.of(
                PipelineStep.fatal("Security Validation",         run::validateSignature),
                PipelineStep.fatal("Ledger Validation",           run::validateLedger),
                PipelineStep.fatal("Payment Processing",          run::processPayment),
                PipelineStep.fatal("Result Signature Validation", run::validateResultSignature),
                PipelineStep.fatal("Record Payment",              run::record));
    }

    @Override
    public List<String> validateRequest(Map<String, Object> inputs) {
        return binder.check(inputs, INPUT, PaymentRequest.class, PaymentPipeline::fieldErrors);
    }

    static List<String> fieldErrors(PaymentRequest request) {
        List<String> errors = new ArrayList<>();
        RequestBinder.requireText(errors, request.paymentId(), "paymentId");
        RequestBinder.requireText(errors, request.fromAccountId(), "fromAccountId");
        RequestBinder.requireText(errors, request.toAccountId(), "toAccountId");
        if (request.amount() == null || request.amount().compareTo(BigDecimal.ZERO) <= 0) {
            errors.add("Field 'amount' must be positive");
        }
        return errors;
    }

    /** Per-execution state handed from step to step. */
    private final class Run {

        private final PaymentRequest request;
        private String                  signatureValidationId;
        private String                  ledgerValidationId;
        private PaymentProcessingResult payment;

        Run(PaymentRequest request) {
            this.request = request;
        }

        StepResult validateSignature(WorkflowExecutionContext ctx) {
            SignatureCheck check = signatureGate.verifyRequest(
                    request, request.fromAccountId(), OPERATION, request.signedPayload());
            if (!check.passed()) {
                return check.toFailure();
            }
            signatureValidationId = check.validationId();
            return StepResult.ok();
        }

        StepResult validateLedger(WorkflowExecutionContext ctx) {
            LedgerValidationResult result = ledger.validateTransaction(new LedgerValidationRequest(
                    OPERATION, request.amount(), request.fromAccountId(), request.toAccountId(),
                    signatureValidationId));
            if (!result.valid()) {
                return StepResult.rejected("Ledger validation failed: " + result.message());
            }
            ledgerValidationId = result.validationId();
            return StepResult.ok();
        }

        StepResult processPayment(WorkflowExecutionContext ctx) {
            payment = gateway.processPayment(new PaymentProcessingRequest(
                    request.paymentId(), request.amount(), request.fromAccountId(),
                    request.toAccountId(), request.userId(), signatureValidationId, ledgerValidationId));
            if (payment.failed()) {
                return StepResult.rejected("Payment processing failed: " + payment.message());
            }
            return StepResult.ok();
        }

        StepResult validateResultSignature(WorkflowExecutionContext ctx) {
            Map<String, Object> signedResult = new LinkedHashMap<>();
            signedResult.put("paymentId", payment.paymentId());
            signedResult.put("transactionId", payment.transactionId());
            signedResult.put("status", payment.status());
            SignatureCheck check = signatureGate.verifyResult(
                    signatureValidationId, signedResult, payment.resultSignature(), SIGNING_SERVICE);
            return check.passed() ? StepResult.ok() : check.toFailure();
        }

        StepResult record(WorkflowExecutionContext ctx) {
            Map<String, Object> results = new LinkedHashMap<>();
            results.put("paymentId", payment.paymentId() != null ? payment.paymentId() : request.paymentId());
            results.put("transactionId", payment.transactionId());
            results.put("paymentStatus", payment.status());
            results.put("signatureValidationId", signatureValidationId);
            results.put("ledgerValidationId", ledgerValidationId);
            return StepResult.ok(results);
        }
    }
}
