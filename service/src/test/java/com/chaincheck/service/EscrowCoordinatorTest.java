package com.chaincheck.service;

import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.error.SettlementInvariantException;
import com.chaincheck.ledger.ChainReceipt;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.SettlementOperation;
import com.chaincheck.settlement.MockSettlementBackend;
import com.chaincheck.settlement.SettlementBackend;
import com.chaincheck.settlement.SettlementResult;
import com.chaincheck.settlement.SubmittedTransaction;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Escrow lifecycle through the settlement executor, against the mock backend.
 */
public class EscrowCoordinatorTest {

    private SettlementTestFixture fixtureWithMockBackend() {
        MockSettlementBackend backend = new MockSettlementBackend(
                Clock.fixed(SettlementTestFixture.NOW, ZoneOffset.UTC), Duration.ofDays(30), null);
        return new SettlementTestFixture(true, spy(backend));
    }

    // ==================== End-to-end ====================

    @Test
    public void depositReleaseTwice_ShouldPayOnceAndReturnSameTransaction() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");

        SettlementResult deposit = fixture.escrowCoordinator.deposit(delivery.getId());
        assertThat(deposit.success()).isTrue();
        assertThat(fixture.reload(delivery).getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.ESCROWED);
        assertThat(fixture.reload(delivery).getEscrowDepositTxHash()).isEqualTo(deposit.transactionHash());

        fixture.markDelivered(delivery);
        SettlementResult firstRelease = fixture.escrowCoordinator.release(delivery.getId());
        SettlementResult secondRelease = fixture.escrowCoordinator.release(delivery.getId());

        assertThat(firstRelease.success()).isTrue();
        assertThat(secondRelease.success()).isTrue();
        assertThat(secondRelease.transactionHash()).isEqualTo(firstRelease.transactionHash());
        verify(fixture.backend, times(1)).submitRelease(delivery.getId().toString());

        Delivery paid = fixture.reload(delivery);
        assertThat(paid.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(paid.getPaymentState().getTransactionHash()).isEqualTo(firstRelease.transactionHash());
        assertThat(paid.getEscrowReleaseTxHash()).isEqualTo(firstRelease.transactionHash());
        assertThat(paid.getSettlementOperation()).isNull();
        assertThat(paid.getPendingTransactionHash()).isNull();

        assertThat(fixture.escrowCoordinator.getEscrowStatus(delivery.getId()).orElseThrow().released()).isTrue();
    }

    @Test
    public void deposit_Twice_ShouldViolateInvariantAndSubmitOnce() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");

        SettlementResult first = fixture.escrowCoordinator.deposit(delivery.getId());

        assertThat(first.success()).isTrue();
        assertThatThrownBy(() -> fixture.escrowCoordinator.deposit(delivery.getId()))
                .isInstanceOf(SettlementInvariantException.class)
                .hasMessageContaining("Escrow already exists for delivery " + delivery.getId());
        verify(fixture.backend, times(1)).submitDeposit(anyString(), anyString(), any());

        Delivery escrowed = fixture.reload(delivery);
        assertThat(escrowed.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.ESCROWED);
        assertThat(escrowed.getEscrowDepositTxHash()).isEqualTo(first.transactionHash());
        assertThat(escrowed.getSettlementOperation()).isNull();
    }

    @Test
    public void autoRefund_BeforeDeadline_ShouldFailWithoutStateChange() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");
        fixture.escrowCoordinator.deposit(delivery.getId());

        SettlementResult result = fixture.escrowCoordinator.autoRefund(delivery.getId());

        assertThat(result.success()).isFalse();
        assertThat(result.inProgress()).isFalse();
        assertThat(result.error()).contains("deadline not reached");
        Delivery unchanged = fixture.reload(delivery);
        assertThat(unchanged.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.ESCROWED);
        assertThat(unchanged.getSettlementOperation()).isNull();
        assertThat(fixture.escrowCoordinator.canAutoRefund(delivery.getId())).isFalse();
    }

    @Test
    public void refund_AfterDeposit_ShouldRefundAndBlockRelease() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");
        fixture.escrowCoordinator.deposit(delivery.getId());

        SettlementResult refund = fixture.escrowCoordinator.refund(delivery.getId());

        assertThat(refund.success()).isTrue();
        Delivery refunded = fixture.reload(delivery);
        assertThat(refunded.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(refunded.getEscrowRefundTxHash()).isEqualTo(refund.transactionHash());

        fixture.markDelivered(delivery);
        assertThatThrownBy(() -> fixture.escrowCoordinator.release(delivery.getId()))
                .isInstanceOf(SettlementInvariantException.class)
                .hasMessageContaining("refunded");
        verify(fixture.backend, never()).submitRelease(anyString());
    }

    // ==================== Invariants ====================

    @Test
    public void refund_OnPendingDelivery_ShouldViolateInvariant() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");

        assertThatThrownBy(() -> fixture.escrowCoordinator.refund(delivery.getId()))
                .isInstanceOf(SettlementInvariantException.class)
                .hasMessageContaining("no escrow deposit");
        assertThat(fixture.reload(delivery).getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(fixture.reload(delivery).getSettlementOperation()).isNull();
    }

    @Test
    public void release_OnPendingDelivery_ShouldViolateInvariant() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");
        fixture.markDelivered(delivery);

        assertThatThrownBy(() -> fixture.escrowCoordinator.release(delivery.getId()))
                .isInstanceOf(SettlementInvariantException.class);
        verify(fixture.backend, never()).submitRelease(anyString());
    }

    @Test
    public void release_BeforeDelivered_ShouldViolateInvariant() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");
        fixture.escrowCoordinator.deposit(delivery.getId());

        assertThatThrownBy(() -> fixture.escrowCoordinator.release(delivery.getId()))
                .isInstanceOf(SettlementInvariantException.class)
                .hasMessageContaining("without a location proof");
    }

    @Test
    public void deposit_WithUnsupportedCurrency_ShouldRejectBeforeSubmission() {
        SettlementTestFixture fixture = fixtureWithMockBackend();
        Delivery delivery = fixture.paidDelivery("0.01");
        delivery.getPaymentState().setCurrency("USDC");

        assertThatThrownBy(() -> fixture.escrowCoordinator.deposit(delivery.getId()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Only ETH is supported");
        verify(fixture.backend, never()).submitDeposit(anyString(), anyString(), any());
        assertThat(fixture.reload(delivery).getSettlementOperation()).isNull();
    }

    // ==================== Confirmation ====================

    @Test
    public void release_WhenReceiptNotYetAvailable_ShouldStayPendingUntilReconciled() {
        SettlementBackend backend = mock(SettlementBackend.class);
        SettlementTestFixture fixture = new SettlementTestFixture(true, backend);
        Delivery delivery = fixture.paidDelivery("0.01");
        delivery.getPaymentState().setPaymentStatus(PaymentStatus.ESCROWED);
        delivery.setEscrowDepositTxHash("0xdeposit");
        fixture.markDelivered(delivery);

        when(backend.submitRelease(delivery.getId().toString()))
                .thenReturn(new SubmittedTransaction("0xrelease", SettlementOperation.RELEASE));
        when(backend.awaitReceipt(eq("0xrelease"), any(Duration.class))).thenReturn(Optional.empty());

        SettlementResult result = fixture.escrowCoordinator.release(delivery.getId());

        assertThat(result.inProgress()).isTrue();
        assertThat(result.transactionHash()).isEqualTo("0xrelease");
        Delivery pending = fixture.reload(delivery);
        assertThat(pending.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.ESCROWED);
        assertThat(pending.getPendingTransactionHash()).isEqualTo("0xrelease");
        assertThat(pending.getSettlementClaimedAt()).isNull();

        when(backend.getReceipt("0xrelease")).thenReturn(Optional.of(new ChainReceipt("0xrelease", 42L, true, null)));
        Optional<SettlementResult> reconciled = fixture.executor.reconcile(delivery.getId());

        assertThat(reconciled).isPresent();
        assertThat(reconciled.get().success()).isTrue();
        assertThat(reconciled.get().blockNumber()).isEqualTo(42L);
        Delivery paid = fixture.reload(delivery);
        assertThat(paid.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(paid.getPendingTransactionHash()).isNull();
        verify(backend, times(1)).submitRelease(anyString());
    }

    @Test
    public void release_WhenPendingTransactionExists_ShouldConfirmInsteadOfResubmitting() {
        SettlementBackend backend = mock(SettlementBackend.class);
        SettlementTestFixture fixture = new SettlementTestFixture(true, backend);
        Delivery delivery = fixture.paidDelivery("0.01");
        delivery.getPaymentState().setPaymentStatus(PaymentStatus.ESCROWED);
        delivery.setEscrowDepositTxHash("0xdeposit");
        delivery.setSettlementOperation(SettlementOperation.RELEASE);
        delivery.setPendingTransactionHash("0xrelease");
        fixture.markDelivered(delivery);

        when(backend.awaitReceipt(eq("0xrelease"), any(Duration.class)))
                .thenReturn(Optional.of(new ChainReceipt("0xrelease", 7L, true, null)));

        SettlementResult result = fixture.escrowCoordinator.release(delivery.getId());

        assertThat(result.success()).isTrue();
        assertThat(result.transactionHash()).isEqualTo("0xrelease");
        verify(backend, never()).submitRelease(anyString());
        assertThat(fixture.reload(delivery).getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
    }

    @Test
    public void release_WhenReceiptReverted_ShouldMarkFailedWithReason() {
        SettlementBackend backend = mock(SettlementBackend.class);
        SettlementTestFixture fixture = new SettlementTestFixture(true, backend);
        Delivery delivery = fixture.paidDelivery("0.01");
        delivery.getPaymentState().setPaymentStatus(PaymentStatus.ESCROWED);
        delivery.setEscrowDepositTxHash("0xdeposit");
        fixture.markDelivered(delivery);

        when(backend.submitRelease(delivery.getId().toString()))
                .thenReturn(new SubmittedTransaction("0xrelease", SettlementOperation.RELEASE));
        when(backend.awaitReceipt(eq("0xrelease"), any(Duration.class)))
                .thenReturn(Optional.of(new ChainReceipt("0xrelease", 9L, false, "Transfer failed")));

        SettlementResult result = fixture.escrowCoordinator.release(delivery.getId());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Transfer failed");
        Delivery failed = fixture.reload(delivery);
        assertThat(failed.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(failed.getPaymentState().getError()).isEqualTo("Transfer failed");
        assertThat(failed.getPendingTransactionHash()).isNull();
    }
}
