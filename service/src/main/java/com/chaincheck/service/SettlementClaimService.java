package com.chaincheck.service;

import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.ledger.ChainReceipt;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.PaymentState;
import com.chaincheck.model.SettlementOperation;
import com.chaincheck.repository.DeliveryRepository;
import com.chaincheck.settlement.SettlementContext;
import com.chaincheck.settlement.SettlementResult;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Short, row-locked transactions around a settlement.
 *
 * <p>Every method locks the delivery with {@code SELECT ... FOR UPDATE}, reads or writes
 * the settlement claim and commits. None of them performs a network call, so the lock
 * is never held while waiting for the chain.
 *
 * <p>Claim lifecycle:
 * <pre>
 * claim → ACQUIRED → recordSubmission → complete | fail | suspend
 *                  → abandon (nothing was submitted)
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementClaimService {

    private final DeliveryRepository deliveryRepository;
    private final PaymentStatusStateMachine paymentStatusStateMachine;
    private final SettlementContext settlementContext;
    private final Clock clock;

    /**
     * Claims the settlement of a delivery for one operation.
     *
     * @param deliveryId   Delivery ID
     * @param operation    Operation the caller wants to perform
     * @param precondition Evaluated on the locked delivery; a present result means the
     *                     operation already happened and nothing must be submitted.
     *                     Invariant violations are thrown from here.
     * @return Claim outcome
     * @throws EntityNotFoundException if the delivery does not exist
     */
    @Transactional
    public SettlementClaim claim(UUID deliveryId, SettlementOperation operation,
                                 Function<Delivery, Optional<SettlementResult>> precondition) {
        Delivery delivery = lock(deliveryId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (delivery.hasActiveClaim(now, settlementContext.claimTtl())) {
            log.debug("Settlement of delivery {} is claimed by {} since {}", deliveryId,
                    delivery.getSettlementOperation(), delivery.getSettlementClaimedAt());
            return SettlementClaim.busy(delivery);
        }

        if (delivery.getPendingTransactionHash() != null) {
            delivery.setSettlementClaimedAt(now);
            save(delivery);
            log.info("Resuming confirmation of {} tx {} for delivery {}", delivery.getSettlementOperation(),
                    delivery.getPendingTransactionHash(), deliveryId);
            return SettlementClaim.resume(delivery);
        }

        Optional<SettlementResult> recorded = precondition.apply(delivery);
        if (recorded.isPresent()) {
            return SettlementClaim.settled(delivery, recorded.get());
        }

        delivery.setSettlementOperation(operation);
        delivery.setSettlementClaimedAt(now);
        save(delivery);
        log.info("Settlement {} claimed for delivery {}", operation, deliveryId);
        return SettlementClaim.acquired(delivery);
    }

    /**
     * Claims a delivery with a pending transaction for background reconciliation.
     *
     * @return The claimed delivery; empty when it has nothing pending or is claimed by a request
     */
    @Transactional
    public Optional<Delivery> claimForReconciliation(UUID deliveryId) {
        Delivery delivery = lock(deliveryId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (delivery.getPendingTransactionHash() == null
                || delivery.hasActiveClaim(now, settlementContext.claimTtl())) {
            return Optional.empty();
        }
        delivery.setSettlementClaimedAt(now);
        return Optional.of(save(delivery));
    }

    /**
     * Persists the submitted transaction hash before its receipt is awaited.
     */
    @Transactional
    public void recordSubmission(UUID deliveryId, String transactionHash) {
        Delivery delivery = lock(deliveryId);
        delivery.setPendingTransactionHash(transactionHash);
        delivery.setSettlementClaimedAt(LocalDateTime.now(clock));
        save(delivery);
    }

    /**
     * Records a confirmed settlement transaction and releases the claim.
     *
     * @param deliveryId      Delivery ID
     * @param operation       Operation the transaction performed
     * @param receipt         Successful receipt
     * @param contractAddress Escrow contract the transaction went to, if any
     */
    @Transactional
    public Delivery complete(UUID deliveryId, SettlementOperation operation, ChainReceipt receipt,
                             String contractAddress) {
        Delivery delivery = lock(deliveryId);
        PaymentState paymentState = delivery.getPaymentState();

        PaymentStatus target;
        switch (operation) {
            case DEPOSIT -> {
                delivery.setEscrowContractAddress(contractAddress);
                delivery.setEscrowDepositTxHash(receipt.transactionHash());
                delivery.setEscrowDepositBlock(receipt.blockNumber());
                target = PaymentStatus.ESCROWED;
            }
            case RELEASE -> {
                delivery.setEscrowReleaseTxHash(receipt.transactionHash());
                delivery.setEscrowReleaseBlock(receipt.blockNumber());
                target = PaymentStatus.PAID;
            }
            case REFUND, AUTO_REFUND -> {
                delivery.setEscrowRefundTxHash(receipt.transactionHash());
                delivery.setEscrowRefundBlock(receipt.blockNumber());
                target = PaymentStatus.REFUNDED;
            }
            default -> target = PaymentStatus.PAID;
        }

        paymentStatusStateMachine.validateTransition(paymentState.getPaymentStatus(), target);
        paymentState.setPaymentStatus(target);
        paymentState.setTransactionHash(receipt.transactionHash());
        paymentState.setBlockNumber(receipt.blockNumber());
        paymentState.setError(null);
        delivery.clearClaim();

        log.info("Settlement {} confirmed for delivery {}: tx={}, block={}, paymentStatus={}",
                operation, deliveryId, receipt.transactionHash(), receipt.blockNumber(), target);
        return save(delivery);
    }

    /**
     * Records a failed settlement and releases the claim. The payment status becomes
     * FAILED where that transition is allowed.
     */
    @Transactional
    public Delivery fail(UUID deliveryId, String error) {
        Delivery delivery = lock(deliveryId);
        PaymentState paymentState = delivery.getPaymentState();

        if (paymentStatusStateMachine.isTransitionAllowed(paymentState.getPaymentStatus(), PaymentStatus.FAILED)) {
            paymentState.setPaymentStatus(PaymentStatus.FAILED);
        }
        paymentState.setError(error);
        delivery.clearClaim();

        log.warn("Settlement failed for delivery {}: {}", deliveryId, error);
        return save(delivery);
    }

    /**
     * Releases a claim after which nothing was submitted. Payment state is unchanged.
     */
    @Transactional
    public void abandon(UUID deliveryId) {
        Delivery delivery = lock(deliveryId);
        if (delivery.getPendingTransactionHash() == null) {
            delivery.clearClaim();
        } else {
            delivery.setSettlementClaimedAt(null);
        }
        save(delivery);
    }

    /**
     * Releases the claim but keeps the pending transaction for reconciliation.
     */
    @Transactional
    public void suspend(UUID deliveryId) {
        Delivery delivery = lock(deliveryId);
        delivery.setSettlementClaimedAt(null);
        save(delivery);
        log.info("Settlement {} of delivery {} left pending: tx={}", delivery.getSettlementOperation(),
                deliveryId, delivery.getPendingTransactionHash());
    }

    private Delivery lock(UUID deliveryId) {
        return deliveryRepository.findByIdForUpdate(deliveryId)
                .orElseThrow(() -> new EntityNotFoundException("Delivery not found: " + deliveryId));
    }

    private Delivery save(Delivery delivery) {
        delivery.setUpdatedAt(LocalDateTime.now(clock));
        return deliveryRepository.save(delivery);
    }
}
