package com.chaincheck.service;

import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.error.SettlementRevertedException;
import com.chaincheck.model.Delivery;
import com.chaincheck.settlement.MockSettlementBackend;
import com.chaincheck.settlement.SettlementResult;
import com.chaincheck.settlement.SubmittedTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Two requests settling the same delivery at once.
 */
public class SettlementExecutorTest {

    private final ExecutorService requests = Executors.newFixedThreadPool(2);

    @AfterEach
    public void tearDown() {
        requests.shutdownNow();
    }

    /**
     * Holds the first release inside the backend until the test opens the gate.
     */
    static class GatedSettlementBackend extends MockSettlementBackend {

        final CountDownLatch firstReleaseEntered = new CountDownLatch(1);
        final CountDownLatch gate = new CountDownLatch(1);
        final AtomicInteger releases = new AtomicInteger();
        private final boolean rejectFirstRelease;

        GatedSettlementBackend(boolean rejectFirstRelease) {
            super(Clock.fixed(SettlementTestFixture.NOW, ZoneOffset.UTC), Duration.ofDays(30), null);
            this.rejectFirstRelease = rejectFirstRelease;
        }

        @Override
        public SubmittedTransaction submitRelease(String deliveryId) {
            if (releases.incrementAndGet() == 1) {
                firstReleaseEntered.countDown();
                try {
                    if (!gate.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("Release gate was never opened");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                if (rejectFirstRelease) {
                    throw new SettlementRevertedException("Release rejected");
                }
            }
            return super.submitRelease(deliveryId);
        }
    }

    private Delivery escrowedAndDelivered(SettlementTestFixture fixture) {
        Delivery delivery = fixture.paidDelivery("0.01");
        SettlementResult deposit = fixture.escrowCoordinator.deposit(delivery.getId());
        assertThat(deposit.success()).isTrue();
        fixture.markDelivered(delivery);
        return delivery;
    }

    @Test
    public void release_WhileAnotherReleaseIsInFlight_ShouldWaitAndReturnSameTransaction() throws Exception {
        GatedSettlementBackend backend = new GatedSettlementBackend(false);
        SettlementTestFixture fixture = new SettlementTestFixture(true, backend);
        Delivery delivery = escrowedAndDelivered(fixture);

        Future<SettlementResult> first = requests.submit(() -> fixture.escrowCoordinator.release(delivery.getId()));
        assertThat(backend.firstReleaseEntered.await(5, TimeUnit.SECONDS)).isTrue();

        Future<SettlementResult> second = requests.submit(() -> fixture.escrowCoordinator.release(delivery.getId()));
        // the second request polls the delivery only while the first one holds the claim
        verify(fixture.deliveryRepository, timeout(5000).atLeastOnce()).findById(delivery.getId());
        backend.gate.countDown();

        SettlementResult firstResult = first.get(5, TimeUnit.SECONDS);
        SettlementResult secondResult = second.get(5, TimeUnit.SECONDS);

        assertThat(firstResult.success()).isTrue();
        assertThat(secondResult.success()).isTrue();
        assertThat(secondResult.transactionHash()).isEqualTo(firstResult.transactionHash());
        assertThat(backend.releases.get()).isEqualTo(1);

        Delivery paid = fixture.reload(delivery);
        assertThat(paid.getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(paid.getPaymentState().getTransactionHash()).isEqualTo(firstResult.transactionHash());
        assertThat(paid.getSettlementOperation()).isNull();
    }

    @Test
    public void release_WhenInFlightReleaseIsRejected_ShouldClaimAgainAndSubmit() throws Exception {
        GatedSettlementBackend backend = new GatedSettlementBackend(true);
        SettlementTestFixture fixture = new SettlementTestFixture(true, backend);
        Delivery delivery = escrowedAndDelivered(fixture);

        Future<SettlementResult> first = requests.submit(() -> fixture.escrowCoordinator.release(delivery.getId()));
        assertThat(backend.firstReleaseEntered.await(5, TimeUnit.SECONDS)).isTrue();

        Future<SettlementResult> second = requests.submit(() -> fixture.escrowCoordinator.release(delivery.getId()));
        verify(fixture.deliveryRepository, timeout(5000).atLeastOnce()).findById(delivery.getId());
        backend.gate.countDown();

        SettlementResult firstResult = first.get(5, TimeUnit.SECONDS);
        SettlementResult secondResult = second.get(5, TimeUnit.SECONDS);

        assertThat(firstResult.success()).isFalse();
        assertThat(firstResult.error()).isEqualTo("Release rejected");
        assertThat(secondResult.success()).isTrue();
        assertThat(backend.releases.get()).isEqualTo(2);
        assertThat(fixture.reload(delivery).getPaymentState().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(fixture.reload(delivery).getPaymentState().getTransactionHash())
                .isEqualTo(secondResult.transactionHash());
    }
}
