package com.chaincheck.service;

import com.chaincheck.api.model.DeliveryStatus;
import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.error.SettlementInvariantException;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.PaymentState;
import com.chaincheck.model.SettlementOperation;
import com.chaincheck.settlement.EscrowState;
import com.chaincheck.settlement.SettlementBackend;
import com.chaincheck.settlement.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.UUID;

/**
 * Escrow operations of a delivery.
 *
 * <p>The escrow of a delivery is keyed by the keccak-256 hash of its ID. Operations:
 * <ul>
 *   <li>deposit - buyer funds locked for the seller, payment ESCROWED</li>
 *   <li>release - funds to the seller once the delivery is proven, payment PAID</li>
 *   <li>refund - funds back to the buyer, payment REFUNDED</li>
 *   <li>autoRefund - refund anyone may trigger after the auto-refund window</li>
 * </ul>
 *
 * <p>Repeating a release or refund that already succeeded returns the recorded transaction
 * and submits nothing. A second deposit, or releasing a refunded escrow (or the reverse),
 * violates a settlement invariant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowCoordinator {

    private final SettlementExecutor settlementExecutor;
    private final SettlementBackend settlementBackend;
    private final PaymentTermsValidator paymentTermsValidator;

    public SettlementResult deposit(UUID deliveryId) {
        log.info("Escrow deposit requested for delivery {}", deliveryId);
        return settlementExecutor.execute(deliveryId, SettlementOperation.DEPOSIT,
                EscrowCoordinator::depositPrecondition,
                delivery -> {
                    paymentTermsValidator.validate(delivery.getPaymentState());
                    return settlementBackend.submitDeposit(key(delivery),
                            delivery.getPaymentState().getSellerAddress(),
                            toWei(delivery.getPaymentState().getAmount()));
                });
    }

    public SettlementResult release(UUID deliveryId) {
        log.info("Escrow release requested for delivery {}", deliveryId);
        return settlementExecutor.execute(deliveryId, SettlementOperation.RELEASE,
                EscrowCoordinator::releasePrecondition,
                delivery -> settlementBackend.submitRelease(key(delivery)));
    }

    public SettlementResult refund(UUID deliveryId) {
        log.info("Escrow refund requested for delivery {}", deliveryId);
        return settlementExecutor.execute(deliveryId, SettlementOperation.REFUND,
                EscrowCoordinator::refundPrecondition,
                delivery -> settlementBackend.submitRefund(key(delivery)));
    }

    /**
     * Refunds an escrow whose release deadline has passed. The contract rejects the call
     * before the deadline; the payment state is then left unchanged.
     */
    public SettlementResult autoRefund(UUID deliveryId) {
        log.info("Escrow auto-refund requested for delivery {}", deliveryId);
        return settlementExecutor.execute(deliveryId, SettlementOperation.AUTO_REFUND,
                EscrowCoordinator::refundPrecondition,
                delivery -> settlementBackend.submitAutoRefund(key(delivery)));
    }

    /**
     * On-chain escrow of a delivery; empty when none exists.
     */
    public Optional<EscrowState> getEscrowStatus(UUID deliveryId) {
        return settlementBackend.getEscrow(deliveryId.toString());
    }

    public boolean canAutoRefund(UUID deliveryId) {
        return settlementBackend.canAutoRefund(deliveryId.toString());
    }

    static BigInteger toWei(BigDecimal amountEth) {
        return Convert.toWei(amountEth, Convert.Unit.ETHER).toBigInteger();
    }

    private static String key(Delivery delivery) {
        return delivery.getId().toString();
    }

    private static Optional<SettlementResult> depositPrecondition(Delivery delivery) {
        PaymentState paymentState = delivery.getPaymentState();
        if (!paymentState.isRequiresPaymentOnDelivery()) {
            throw new SettlementInvariantException(
                    "Delivery " + delivery.getId() + " does not require payment; nothing to escrow");
        }
        if (delivery.getEscrowDepositTxHash() != null) {
            throw new SettlementInvariantException("Escrow already exists for delivery " + delivery.getId()
                    + " (tx " + delivery.getEscrowDepositTxHash() + ")");
        }
        if (paymentState.getPaymentStatus() == PaymentStatus.PAID
                || paymentState.getPaymentStatus() == PaymentStatus.REFUNDED) {
            throw new SettlementInvariantException("Cannot deposit escrow for delivery " + delivery.getId()
                    + ": payment is already " + paymentState.getPaymentStatus());
        }
        return Optional.empty();
    }

    private static Optional<SettlementResult> releasePrecondition(Delivery delivery) {
        PaymentState paymentState = delivery.getPaymentState();
        if (paymentState.getPaymentStatus() == PaymentStatus.PAID) {
            return Optional.of(SettlementResult.confirmed(
                    paymentState.getTransactionHash(), paymentState.getBlockNumber()));
        }
        if (paymentState.getPaymentStatus() == PaymentStatus.REFUNDED) {
            throw new SettlementInvariantException(
                    "Cannot release payment for delivery " + delivery.getId() + ": escrow was refunded");
        }
        if (delivery.getEscrowDepositTxHash() == null) {
            throw new SettlementInvariantException("Cannot release payment for delivery " + delivery.getId()
                    + ": no escrow deposit (payment " + paymentState.getPaymentStatus() + ")");
        }
        if (delivery.getStatus() != DeliveryStatus.DELIVERED || delivery.getProofHash() == null) {
            throw new SettlementInvariantException("Cannot release payment for delivery " + delivery.getId()
                    + ": delivery is " + delivery.getStatus() + " without a location proof");
        }
        return Optional.empty();
    }

    private static Optional<SettlementResult> refundPrecondition(Delivery delivery) {
        PaymentState paymentState = delivery.getPaymentState();
        if (paymentState.getPaymentStatus() == PaymentStatus.REFUNDED) {
            return Optional.of(SettlementResult.confirmed(
                    paymentState.getTransactionHash(), paymentState.getBlockNumber()));
        }
        if (paymentState.getPaymentStatus() == PaymentStatus.PAID) {
            throw new SettlementInvariantException(
                    "Cannot refund delivery " + delivery.getId() + ": payment was already released");
        }
        if (delivery.getEscrowDepositTxHash() == null) {
            throw new SettlementInvariantException("Cannot refund delivery " + delivery.getId()
                    + ": no escrow deposit (payment " + paymentState.getPaymentStatus() + ")");
        }
        return Optional.empty();
    }
}
