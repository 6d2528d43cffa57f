package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.DownstreamException;
import com.quantumskylink.orchestration.client.LedgerClient;
import com.quantumskylink.orchestration.client.PaymentGatewayClient;
import com.quantumskylink.orchestration.client.SignatureServiceClient;
import com.quantumskylink.orchestration.client.dto.LedgerValidationRequest;
import com.quantumskylink.orchestration.client.dto.LedgerValidationResult;
import com.quantumskylink.orchestration.client.dto.PaymentProcessingRequest;
import com.quantumskylink.orchestration.client.dto.PaymentProcessingResult;
import com.quantumskylink.orchestration.client.dto.SignatureValidationResult;
import com.quantumskylink.orchestration.model.ExecutionStatus;
import com.quantumskylink.orchestration.model.FailureKind;
import com.quantumskylink.orchestration.model.HighlightStatus;
import com.quantumskylink.orchestration.model.ValidationResult;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.model.WorkflowHighlight;
import com.quantumskylink.orchestration.pipeline.RequestBinder;
import com.quantumskylink.orchestration.pipeline.SignatureGate;
import com.quantumskylink.orchestration.service.ExecutionOutcome;
import com.quantumskylink.orchestration.service.ExecutionRequest;
import com.quantumskylink.orchestration.service.WorkflowValidationException;
import com.quantumskylink.orchestration.support.ExecutorHarness;
import com.quantumskylink.orchestration.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentPipelineTest {

    @Mock SignatureServiceClient signatures;
    @Mock LedgerClient           ledger;
    @Mock PaymentGatewayClient   gateway;

    private ExecutorHarness harness;

    @BeforeEach
    void setUp() {
        PaymentPipeline pipeline = new PaymentPipeline(
                new RequestBinder(Fixtures.objectMapper()), new SignatureGate(signatures), ledger, gateway);
        harness = new ExecutorHarness(pipeline);
    }

    private ExecutionOutcome execute(Map<String, Object> paymentRequest) {
        return harness.executor.execute(ExecutionRequest.of(
                WorkflowCatalogConfiguration.PAYMENT, Map.of("paymentRequest", paymentRequest), "wallet-app"));
    }

    private void signatureAccepted() {
        when(signatures.validateRequest(any())).thenReturn(new SignatureValidationResult("sv-1", true, null));
    }

    private void ledgerAccepted() {
        when(ledger.validateTransaction(any())).thenReturn(new LedgerValidationResult("lv-1", true, null));
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void execute_allChecksPass_succeedsWithPaymentResults() {
        signatureAccepted();
        ledgerAccepted();
        when(gateway.processPayment(any())).thenReturn(
                new PaymentProcessingResult("pay-1", "tx-9", "COMPLETED", null, "result-sig"));
        when(signatures.validateResult(any())).thenReturn(new SignatureValidationResult("rv-1", true, null));

        ExecutionOutcome outcome = execute(Fixtures.paymentRequest());

        assertThat(outcome.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(outcome.results())
                .containsEntry("paymentId", "pay-1")
                .containsEntry("transactionId", "tx-9")
                .containsEntry("paymentStatus", "COMPLETED")
                .containsEntry("signatureValidationId", "sv-1")
                .containsEntry("ledgerValidationId", "lv-1");

        WorkflowExecutionContext stored = harness.store.get(outcome.executionId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(stored.progressPercent()).isEqualTo(100);
        assertThat(stored.getHighlights())
                .extracting(WorkflowHighlight::step)
                .containsExactly("Security Validation", "Ledger Validation", "Payment Processing",
                        "Result Signature Validation", "Record Payment");
        assertThat(stored.getHighlights())
                .extracting(WorkflowHighlight::status)
                .containsOnly(HighlightStatus.SUCCESS);
    }

    @Test
    void execute_passesValidationIdsDownstream() {
        signatureAccepted();
        ledgerAccepted();
        when(gateway.processPayment(any())).thenReturn(
                new PaymentProcessingResult("pay-1", "tx-9", "COMPLETED", null, "result-sig"));
        when(signatures.validateResult(any())).thenReturn(new SignatureValidationResult("rv-1", true, null));

        execute(Fixtures.paymentRequest());

        ArgumentCaptor<LedgerValidationRequest> ledgerReq = ArgumentCaptor.forClass(LedgerValidationRequest.class);
        verify(ledger).validateTransaction(ledgerReq.capture());
        assertThat(ledgerReq.getValue().signatureValidationId()).isEqualTo("sv-1");
        assertThat(ledgerReq.getValue().amount()).isEqualByComparingTo(new BigDecimal("100"));

        ArgumentCaptor<PaymentProcessingRequest> paymentReq = ArgumentCaptor.forClass(PaymentProcessingRequest.class);
        verify(gateway).processPayment(paymentReq.capture());
        assertThat(paymentReq.getValue().signatureValidationId()).isEqualTo("sv-1");
        assertThat(paymentReq.getValue().ledgerValidationId()).isEqualTo("lv-1");
    }

    // ------------------------------------------------------------------
    // Rejections
    // ------------------------------------------------------------------

    @Test
    void execute_invalidSignature_failsBeforeAnyMoneyMoves() {
        when(signatures.validateRequest(any())).thenReturn(new SignatureValidationResult(null, false, "bad key"));

        ExecutionOutcome outcome = execute(Fixtures.paymentRequest());

        assertThat(outcome.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.AUTHORIZATION);
        assertThat(outcome.errorMessage()).isEqualTo("Signature validation failed: bad key");
        verifyNoInteractions(ledger, gateway);

        WorkflowExecutionContext stored = harness.store.get(outcome.executionId()).orElseThrow();
        assertThat(stored.getCompletedSteps()).isZero();
        assertThat(stored.getHighlights()).hasSize(1);
    }

    @Test
    void execute_missingSignature_failsWithoutCallingVerifier() {
        Map<String, Object> request = new HashMap<>(Fixtures.paymentRequest());
        request.remove("signature");

        ExecutionOutcome outcome = execute(request);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.AUTHORIZATION);
        verifyNoInteractions(signatures, ledger, gateway);
    }

    @Test
    void execute_ledgerRejects_isBusinessFailure() {
        signatureAccepted();
        when(ledger.validateTransaction(any())).thenReturn(new LedgerValidationResult(null, false, "insufficient funds"));

        ExecutionOutcome outcome = execute(Fixtures.paymentRequest());

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.BUSINESS);
        assertThat(outcome.errorMessage()).isEqualTo("Ledger validation failed: insufficient funds");
        verifyNoInteractions(gateway);
    }

    @Test
    void execute_gatewayReportsFailure_isBusinessFailure() {
        signatureAccepted();
        ledgerAccepted();
        when(gateway.processPayment(any())).thenReturn(
                new PaymentProcessingResult("pay-1", null, "failed", "card declined", null));

        ExecutionOutcome outcome = execute(Fixtures.paymentRequest());

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.BUSINESS);
        assertThat(outcome.errorMessage()).isEqualTo("Payment processing failed: card declined");
        verify(signatures, never()).validateResult(any());
    }

    @Test
    void execute_unsignedGatewayResult_isAuthorizationFailure() {
        signatureAccepted();
        ledgerAccepted();
        when(gateway.processPayment(any())).thenReturn(
                new PaymentProcessingResult("pay-1", "tx-9", "COMPLETED", null, null));

        ExecutionOutcome outcome = execute(Fixtures.paymentRequest());

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.AUTHORIZATION);
        assertThat(outcome.errorMessage()).isEqualTo("PaymentGatewayService returned an unsigned result");
        assertThat(outcome.results()).doesNotContainKey("transactionId");
    }

    @Test
    void execute_gatewayUnavailable_isInfrastructureFailure() {
        signatureAccepted();
        ledgerAccepted();
        when(gateway.processPayment(any())).thenThrow(new DownstreamException(
                "payment-gateway", "payment-gateway.processPayment failed: HTTP 503: down", 503));

        ExecutionOutcome outcome = execute(Fixtures.paymentRequest());

        assertThat(outcome.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.INFRASTRUCTURE);
    }

    // ------------------------------------------------------------------
    // Request validation happens before an execution exists
    // ------------------------------------------------------------------

    @Test
    void validate_emptyPaymentRequest_namesEveryMissingFieldAndCreatesNothing() {
        Map<String, Object> inputs = Map.of("paymentRequest", Map.of());

        ValidationResult result = harness.executor.validate(WorkflowCatalogConfiguration.PAYMENT, inputs);
        ValidationResult again  = harness.executor.validate(WorkflowCatalogConfiguration.PAYMENT, inputs);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Field 'paymentId' is required",
                "Field 'fromAccountId' is required",
                "Field 'toAccountId' is required",
                "Field 'amount' must be positive");
        assertThat(again).isEqualTo(result);

        verifyNoInteractions(signatures, ledger, gateway, harness.events);
        harness.clock.advance(ExecutorHarness.TTL.plusMinutes(1));
        assertThat(harness.store.purgeExpired()).isZero();
    }

    @Test
    void execute_emptyPaymentRequest_isRejectedWithoutContextOrEvents() {
        assertThatThrownBy(() -> execute(Map.of()))
                .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.getErrors()).containsExactly(
                        "Field 'paymentId' is required",
                        "Field 'fromAccountId' is required",
                        "Field 'toAccountId' is required",
                        "Field 'amount' must be positive"));

        verifyNoInteractions(signatures, ledger, gateway, harness.events);
        harness.clock.advance(ExecutorHarness.TTL.plusMinutes(1));
        assertThat(harness.store.purgeExpired()).isZero();
    }

    @Test
    void execute_nonPositiveAmount_isRejectedBeforeExecution() {
        Map<String, Object> request = new HashMap<>(Fixtures.paymentRequest());
        request.put("amount", 0);

        assertThatThrownBy(() -> execute(request))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessageContaining("Field 'amount' must be positive");
        verifyNoInteractions(signatures, ledger, gateway);
    }

    @Test
    void validate_completePaymentRequest_isValid() {
        ValidationResult result = harness.executor.validate(
                WorkflowCatalogConfiguration.PAYMENT, Map.of("paymentRequest", Fixtures.paymentRequest()));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }
}
