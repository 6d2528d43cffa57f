package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.MarketplaceClient;
import com.quantumskylink.orchestration.client.SignatureServiceClient;
import com.quantumskylink.orchestration.client.dto.MarketplaceValidationResult;
import com.quantumskylink.orchestration.client.dto.OrderStatusUpdateRequest;
import com.quantumskylink.orchestration.client.dto.OrderStatusUpdateResult;
import com.quantumskylink.orchestration.client.dto.SignatureValidationRequest;
import com.quantumskylink.orchestration.client.dto.SignatureValidationResult;
import com.quantumskylink.orchestration.model.ExecutionStatus;
import com.quantumskylink.orchestration.model.FailureKind;
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

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscrowManagementPipelineTest {

    @Mock SignatureServiceClient signatures;
    @Mock MarketplaceClient      marketplace;

    private ExecutorHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ExecutorHarness(new EscrowManagementPipeline(
                new RequestBinder(Fixtures.objectMapper()), new SignatureGate(signatures), marketplace));
    }

    private ExecutionOutcome execute(String action) {
        Map<String, Object> escrow = Fixtures.signed(Map.of(
                "escrowId", "esc-1",
                "orderId", "ord-1",
                "action", action,
                "buyerId", "buyer-1",
                "sellerId", "seller-1",
                "amount", "5.00",
                "reason", "delivered"));
        return harness.executor.execute(ExecutionRequest.of(
                WorkflowCatalogConfiguration.ESCROW, Map.of("escrowRequest", escrow), "marketplace-ui"));
    }

    private void verifiedOrder() {
        when(signatures.validateRequest(any())).thenReturn(new SignatureValidationResult("sv-4", true, null));
        when(marketplace.verifyOrder(eq("ord-1"), any())).thenReturn(new MarketplaceValidationResult(true, null));
    }

    @Test
    void execute_release_isSignedBySellerAndCompletesOrder() {
        verifiedOrder();
        when(marketplace.updateOrderStatus(eq("ord-1"), any()))
                .thenReturn(new OrderStatusUpdateResult("ord-1", "Completed"));

        ExecutionOutcome outcome = execute("release");

        assertThat(outcome.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(outcome.results())
                .containsEntry("escrowId", "esc-1")
                .containsEntry("action", "release")
                .containsEntry("orderStatus", "Completed");

        ArgumentCaptor<SignatureValidationRequest> sig = ArgumentCaptor.forClass(SignatureValidationRequest.class);
        verify(signatures).validateRequest(sig.capture());
        assertThat(sig.getValue().accountId()).isEqualTo("seller-1");

        ArgumentCaptor<OrderStatusUpdateRequest> update = ArgumentCaptor.forClass(OrderStatusUpdateRequest.class);
        verify(marketplace).updateOrderStatus(eq("ord-1"), update.capture());
        assertThat(update.getValue().status()).isEqualTo("Completed");
        assertThat(update.getValue().signatureValidationId()).isEqualTo("sv-4");
    }

    @Test
    void execute_refund_isSignedByBuyerAndCancelsOrder() {
        verifiedOrder();
        when(marketplace.updateOrderStatus(eq("ord-1"), any()))
                .thenReturn(new OrderStatusUpdateResult("ord-1", "Cancelled"));

        ExecutionOutcome outcome = execute("refund");

        assertThat(outcome.results()).containsEntry("orderStatus", "Cancelled");

        ArgumentCaptor<SignatureValidationRequest> sig = ArgumentCaptor.forClass(SignatureValidationRequest.class);
        verify(signatures).validateRequest(sig.capture());
        assertThat(sig.getValue().accountId()).isEqualTo("buyer-1");

        ArgumentCaptor<OrderStatusUpdateRequest> update = ArgumentCaptor.forClass(OrderStatusUpdateRequest.class);
        verify(marketplace).updateOrderStatus(eq("ord-1"), update.capture());
        assertThat(update.getValue().status()).isEqualTo("Cancelled");
    }

    @Test
    void execute_orderVerificationFails_statusUntouched() {
        when(signatures.validateRequest(any())).thenReturn(new SignatureValidationResult("sv-4", true, null));
        when(marketplace.verifyOrder(eq("ord-1"), any()))
                .thenReturn(new MarketplaceValidationResult(false, "escrow already released"));

        ExecutionOutcome outcome = execute("release");

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.BUSINESS);
        assertThat(outcome.errorMessage()).isEqualTo("Order verification failed: escrow already released");
        verify(marketplace, never()).updateOrderStatus(anyString(), any());
    }

    @Test
    void execute_releaseWithoutSeller_isRejectedBeforeSignatureCheck() {
        Map<String, Object> escrow = Fixtures.signed(Map.of(
                "escrowId", "esc-1",
                "orderId", "ord-1",
                "action", "release",
                "buyerId", "buyer-1"));

        assertThatThrownBy(() -> harness.executor.execute(ExecutionRequest.of(
                WorkflowCatalogConfiguration.ESCROW, Map.of("escrowRequest", escrow), "marketplace-ui")))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessageContaining("Field 'sellerId' is required");
        verifyNoInteractions(signatures, marketplace);
    }

    @Test
    void execute_actionMatchesReleaseCaseSensitively() {
        verifiedOrder();
        when(marketplace.updateOrderStatus(eq("ord-1"), any()))
                .thenReturn(new OrderStatusUpdateResult("ord-1", "Cancelled"));

        execute("Release");

        ArgumentCaptor<SignatureValidationRequest> sig = ArgumentCaptor.forClass(SignatureValidationRequest.class);
        verify(signatures).validateRequest(sig.capture());
        assertThat(sig.getValue().accountId()).isEqualTo("buyer-1");

        ArgumentCaptor<OrderStatusUpdateRequest> update = ArgumentCaptor.forClass(OrderStatusUpdateRequest.class);
        verify(marketplace).updateOrderStatus(eq("ord-1"), update.capture());
        assertThat(update.getValue().status()).isEqualTo("Cancelled");
    }
}
