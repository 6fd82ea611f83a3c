package com.chaincheck.controller;

import com.chaincheck.api.DeliveryApi;
import com.chaincheck.api.request.CreateDeliveryRequest;
import com.chaincheck.api.request.VerifyDeliveryRequest;
import com.chaincheck.api.response.DeliveryResponse;
import com.chaincheck.api.response.EscrowStatusResponse;
import com.chaincheck.api.response.PaymentStateResponse;
import com.chaincheck.api.response.SettlementResponse;
import com.chaincheck.api.response.VerifyDeliveryResponse;
import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.mapper.DeliveryMapper;
import com.chaincheck.model.Delivery;
import com.chaincheck.service.DeliveryPaymentStateMachine;
import com.chaincheck.service.DeliveryVerification;
import com.chaincheck.settlement.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for deliveries.
 *
 * <p>Implements {@link DeliveryApi} interface for:
 * <ul>
 *   <li>Delivery registration and verification</li>
 *   <li>Payment status and escrow operations</li>
 * </ul>
 *
 * <p>Settlement operations answer 200 with {@code success=false} when the chain
 * rejected the transaction, and 202 while the transaction is still unconfirmed.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class DeliveryController implements DeliveryApi {

    private final DeliveryPaymentStateMachine deliveryPaymentStateMachine;

    // ==================== Delivery Operations ====================

    @Override
    public ResponseEntity<DeliveryResponse> createDelivery(CreateDeliveryRequest request) {
        Delivery delivery = deliveryPaymentStateMachine.createDelivery(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(DeliveryMapper.INSTANCE.toDeliveryResponse(delivery));
    }

    @Override
    public ResponseEntity<DeliveryResponse> getDelivery(UUID deliveryId) {
        Delivery delivery = deliveryPaymentStateMachine.getDelivery(deliveryId);
        return ResponseEntity.ok(DeliveryMapper.INSTANCE.toDeliveryResponse(delivery));
    }

    @Override
    public ResponseEntity<VerifyDeliveryResponse> verifyDelivery(UUID deliveryId, VerifyDeliveryRequest request) {
        DeliveryVerification verification = deliveryPaymentStateMachine.verifyDelivery(deliveryId, request);

        DeliveryMapper mapper = DeliveryMapper.INSTANCE;
        VerifyDeliveryResponse response = new VerifyDeliveryResponse(
                mapper.toLocationProofResponse(verification.proof()),
                mapper.toDeliveryResponse(verification.delivery()),
                verification.diviner() != null ? mapper.toDivinerVerificationResponse(verification.diviner()) : null,
                verification.settlement() != null
                        ? mapper.toSettlementResponse(verification.delivery(), "release", verification.settlement())
                        : null
        );
        return ResponseEntity.ok(response);
    }

    // ==================== Payment Operations ====================

    @Override
    public ResponseEntity<PaymentStateResponse> getPaymentStatus(UUID deliveryId) {
        Delivery delivery = deliveryPaymentStateMachine.getPaymentStatus(deliveryId);

        EscrowStatusResponse escrow = null;
        try {
            escrow = deliveryPaymentStateMachine.getEscrowStatus(deliveryId)
                    .map(state -> DeliveryMapper.INSTANCE.toEscrowStatusResponse(state,
                            deliveryPaymentStateMachine.canAutoRefund(deliveryId)))
                    .orElse(null);
        } catch (LedgerUnavailableException e) {
            log.warn("On-chain escrow of delivery {} unavailable: {}", deliveryId, e.getMessage());
        }
        return ResponseEntity.ok(DeliveryMapper.INSTANCE.toPaymentStateResponse(delivery, escrow));
    }

    @Override
    public ResponseEntity<SettlementResponse> depositEscrow(UUID deliveryId) {
        return settlementResponse(deliveryId, "deposit", deliveryPaymentStateMachine.depositEscrow(deliveryId));
    }

    @Override
    public ResponseEntity<SettlementResponse> releasePayment(UUID deliveryId) {
        return settlementResponse(deliveryId, "release", deliveryPaymentStateMachine.releasePayment(deliveryId));
    }

    @Override
    public ResponseEntity<SettlementResponse> refundPayment(UUID deliveryId) {
        return settlementResponse(deliveryId, "refund", deliveryPaymentStateMachine.refundPayment(deliveryId));
    }

    @Override
    public ResponseEntity<SettlementResponse> autoRefund(UUID deliveryId) {
        return settlementResponse(deliveryId, "auto-refund", deliveryPaymentStateMachine.autoRefund(deliveryId));
    }

    private ResponseEntity<SettlementResponse> settlementResponse(UUID deliveryId, String operation,
                                                                  SettlementResult result) {
        Delivery delivery = deliveryPaymentStateMachine.getDelivery(deliveryId);
        SettlementResponse response = DeliveryMapper.INSTANCE.toSettlementResponse(delivery, operation, result);
        HttpStatus status = result.inProgress() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }
}
