package com.chaincheck.service;

import com.chaincheck.api.model.DeliveryStatus;
import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.error.SettlementInvariantException;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.PaymentState;
import com.chaincheck.model.SettlementOperation;
import com.chaincheck.settlement.SettlementBackend;
import com.chaincheck.settlement.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Pays the seller with a plain value transfer from the settlement authority.
 * Used when escrow is disabled. A confirmed transfer is final.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectTransferService {

    private final SettlementExecutor settlementExecutor;
    private final SettlementBackend settlementBackend;
    private final PaymentTermsValidator paymentTermsValidator;

    public SettlementResult transfer(UUID deliveryId) {
        log.info("Direct transfer requested for delivery {}", deliveryId);
        return settlementExecutor.execute(deliveryId, SettlementOperation.TRANSFER,
                this::transferPrecondition,
                delivery -> settlementBackend.submitTransfer(
                        delivery.getPaymentState().getSellerAddress(),
                        EscrowCoordinator.toWei(delivery.getPaymentState().getAmount())));
    }

    private Optional<SettlementResult> transferPrecondition(Delivery delivery) {
        PaymentState paymentState = delivery.getPaymentState();
        if (paymentState.getPaymentStatus() == PaymentStatus.PAID) {
            return Optional.of(SettlementResult.confirmed(
                    paymentState.getTransactionHash(), paymentState.getBlockNumber()));
        }
        if (paymentState.getPaymentStatus() == PaymentStatus.REFUNDED) {
            throw new SettlementInvariantException(
                    "Cannot pay delivery " + delivery.getId() + ": payment was refunded");
        }
        paymentTermsValidator.validate(paymentState);
        if (delivery.getStatus() != DeliveryStatus.DELIVERED || delivery.getProofHash() == null) {
            throw new SettlementInvariantException("Cannot pay delivery " + delivery.getId()
                    + ": delivery is " + delivery.getStatus() + " without a location proof");
        }
        return Optional.empty();
    }
}
