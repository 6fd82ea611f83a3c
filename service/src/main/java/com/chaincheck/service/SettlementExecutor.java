package com.chaincheck.service;

import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.error.SettlementRevertedException;
import com.chaincheck.ledger.ChainReceipt;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.SettlementOperation;
import com.chaincheck.repository.DeliveryRepository;
import com.chaincheck.settlement.SettlementBackend;
import com.chaincheck.settlement.SettlementContext;
import com.chaincheck.settlement.SettlementResult;
import com.chaincheck.settlement.SubmittedTransaction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs one settlement operation against the {@link SettlementBackend} exactly once.
 *
 * <p>Workflow:
 * <pre>
 * 1. Claim the delivery (short locked transaction)
 *    - already settled  → return the recorded result, nothing is submitted
 *    - claimed by another request → poll until it finishes or concurrent-wait elapses
 *    - pending transaction → confirm it instead of submitting a new one
 * 2. Submit the transaction (no lock held)
 * 3. Persist the transaction hash
 * 4. Wait for the receipt (bounded by confirmation-timeout)
 *    - success  → ESCROWED / PAID / REFUNDED
 *    - reverted → FAILED with the revert reason
 *    - timeout  → left pending for {@code SettlementReconciliationScheduler}
 * </pre>
 *
 * <p>A contract rejection detected before broadcast leaves the payment state unchanged,
 * except for direct transfers which have no on-chain state to fall back to.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementExecutor {

    static final long POLL_INTERVAL_MS = 100;

    private final SettlementClaimService claimService;
    private final SettlementBackend settlementBackend;
    private final SettlementContext settlementContext;
    private final DeliveryRepository deliveryRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Executes a settlement operation.
     *
     * @param deliveryId   Delivery ID
     * @param operation    Operation to perform
     * @param precondition Evaluated under the row lock, see {@link SettlementClaimService#claim}
     * @param submitter    Submits the transaction for the claimed delivery
     * @return Settlement result; failures are returned, not thrown
     * @throws LedgerUnavailableException if the settlement chain cannot be reached before submission
     */
    public SettlementResult execute(UUID deliveryId, SettlementOperation operation,
                                    Function<Delivery, Optional<SettlementResult>> precondition,
                                    Function<Delivery, SubmittedTransaction> submitter) {
        Instant deadline = clock.instant().plus(settlementContext.concurrentWait());

        while (true) {
            SettlementClaim claim = claimService.claim(deliveryId, operation, precondition);
            switch (claim.status()) {
                case SETTLED -> {
                    log.info("Settlement {} for delivery {} already recorded: tx={}",
                            operation, deliveryId, claim.result().transactionHash());
                    return claim.result();
                }
                case ACQUIRED -> {
                    return submitAndConfirm(claim.delivery(), operation, submitter);
                }
                case RESUME -> {
                    Delivery delivery = claim.delivery();
                    SettlementOperation pendingOperation = delivery.getSettlementOperation();
                    SettlementResult resumed = confirm(deliveryId, pendingOperation,
                            delivery.getPendingTransactionHash(), true);
                    if (resumed.inProgress() || pendingOperation == operation) {
                        return resumed;
                    }
                    // the pending transaction belonged to another operation; claim again for ours
                }
                case BUSY -> {
                    Optional<SettlementResult> settled = awaitConcurrentSettlement(deliveryId, operation, deadline);
                    if (settled.isPresent()) {
                        return settled.get();
                    }
                }
            }
        }
    }

    /**
     * Confirms the pending transaction of a delivery without waiting for new blocks.
     *
     * @return Result of the confirmation; empty when the delivery has nothing to reconcile
     */
    public Optional<SettlementResult> reconcile(UUID deliveryId) {
        Optional<Delivery> claimed = claimService.claimForReconciliation(deliveryId);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }

        Delivery delivery = claimed.get();
        if (delivery.getSettlementOperation() == null) {
            log.error("Delivery {} has pending tx {} without a settlement operation",
                    deliveryId, delivery.getPendingTransactionHash());
            claimService.suspend(deliveryId);
            return Optional.empty();
        }
        return Optional.of(confirm(deliveryId, delivery.getSettlementOperation(),
                delivery.getPendingTransactionHash(), false));
    }

    /**
     * Reconciles every delivery whose settlement transaction was left unconfirmed.
     *
     * @return Number of deliveries whose settlement is now final
     */
    public int reconcilePendingSettlements() {
        LocalDateTime claimedBefore = LocalDateTime.now(clock).minus(settlementContext.claimTtl());
        int settled = 0;
        for (UUID deliveryId : deliveryRepository.findPendingSettlementIds(claimedBefore)) {
            try {
                Optional<SettlementResult> result = reconcile(deliveryId);
                if (result.isPresent() && !result.get().inProgress()) {
                    settled++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to reconcile settlement of delivery {}: {}", deliveryId, e.getMessage(), e);
            }
        }
        return settled;
    }

    private SettlementResult submitAndConfirm(Delivery delivery, SettlementOperation operation,
                                              Function<Delivery, SubmittedTransaction> submitter) {
        UUID deliveryId = delivery.getId();
        SubmittedTransaction submitted;
        try {
            submitted = submitter.apply(delivery);
        } catch (SettlementRevertedException e) {
            counter("chaincheck.settlement.rejected", operation).increment();
            if (operation == SettlementOperation.TRANSFER) {
                claimService.fail(deliveryId, e.getMessage());
            } else {
                log.warn("Settlement {} for delivery {} rejected by contract: {}", operation, deliveryId, e.getMessage());
                claimService.abandon(deliveryId);
            }
            return SettlementResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            if (operation == SettlementOperation.TRANSFER) {
                claimService.fail(deliveryId, e.getMessage());
            } else {
                claimService.abandon(deliveryId);
            }
            throw e;
        }

        counter("chaincheck.settlement.submitted", operation).increment();
        claimService.recordSubmission(deliveryId, submitted.transactionHash());
        return confirm(deliveryId, operation, submitted.transactionHash(), true);
    }

    private SettlementResult confirm(UUID deliveryId, SettlementOperation operation, String transactionHash,
                                     boolean wait) {
        Optional<ChainReceipt> receipt;
        try {
            receipt = wait
                    ? settlementBackend.awaitReceipt(transactionHash, settlementContext.confirmationTimeout())
                    : settlementBackend.getReceipt(transactionHash);
        } catch (LedgerUnavailableException e) {
            log.warn("Receipt lookup for {} tx {} failed: {}", operation, transactionHash, e.getMessage());
            claimService.suspend(deliveryId);
            return SettlementResult.inProgress(transactionHash);
        }

        if (receipt.isEmpty()) {
            claimService.suspend(deliveryId);
            return SettlementResult.inProgress(transactionHash);
        }

        if (!receipt.get().success()) {
            String reason = receipt.get().revertReason() != null
                    ? receipt.get().revertReason()
                    : operation + " transaction reverted";
            counter("chaincheck.settlement.reverted", operation).increment();
            claimService.fail(deliveryId, reason);
            return SettlementResult.failure(reason, transactionHash);
        }

        claimService.complete(deliveryId, operation, receipt.get(), settlementBackend.contractAddress());
        counter("chaincheck.settlement.confirmed", operation).increment();
        return SettlementResult.confirmed(transactionHash, receipt.get().blockNumber());
    }

    /**
     * Polls the delivery while another request owns its settlement.
     *
     * @return The winner's result, or in-progress once the deadline passes; empty when the
     * claim was released without the requested outcome and the caller should claim again
     */
    private Optional<SettlementResult> awaitConcurrentSettlement(UUID deliveryId, SettlementOperation operation,
                                                                 Instant deadline) {
        while (true) {
            Delivery delivery = deliveryRepository.findById(deliveryId)
                    .orElseThrow(() -> new EntityNotFoundException("Delivery not found: " + deliveryId));

            Optional<SettlementResult> settled = settledView(delivery, operation);
            if (settled.isPresent()) {
                return settled;
            }
            if (!delivery.hasActiveClaim(LocalDateTime.now(clock), settlementContext.claimTtl())) {
                return Optional.empty();
            }
            if (!clock.instant().isBefore(deadline)) {
                log.info("Settlement {} for delivery {} still in progress after {}",
                        operation, deliveryId, settlementContext.concurrentWait());
                return Optional.of(SettlementResult.inProgress(delivery.getPendingTransactionHash()));
            }

            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.of(SettlementResult.inProgress(delivery.getPendingTransactionHash()));
            }
        }
    }

    private static Optional<SettlementResult> settledView(Delivery delivery, SettlementOperation operation) {
        PaymentStatus status = delivery.getPaymentState().getPaymentStatus();
        String transactionHash = delivery.getPaymentState().getTransactionHash();
        Long blockNumber = delivery.getPaymentState().getBlockNumber();

        switch (operation) {
            case DEPOSIT -> {
                if (delivery.getEscrowDepositTxHash() != null) {
                    return Optional.of(SettlementResult.confirmed(
                            delivery.getEscrowDepositTxHash(), delivery.getEscrowDepositBlock()));
                }
            }
            case RELEASE, TRANSFER -> {
                if (status == PaymentStatus.PAID) {
                    return Optional.of(SettlementResult.confirmed(transactionHash, blockNumber));
                }
            }
            case REFUND, AUTO_REFUND -> {
                if (status == PaymentStatus.REFUNDED) {
                    return Optional.of(SettlementResult.confirmed(transactionHash, blockNumber));
                }
            }
        }
        return Optional.empty();
    }

    private Counter counter(String name, SettlementOperation operation) {
        return Counter.builder(name)
                .tag("operation", operation.name().toLowerCase())
                .register(meterRegistry);
    }
}
