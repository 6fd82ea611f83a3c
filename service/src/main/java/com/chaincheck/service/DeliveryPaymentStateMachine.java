package com.chaincheck.service;

import com.chaincheck.api.model.DeliveryStatus;
import com.chaincheck.api.model.PaymentStatus;
import com.chaincheck.api.request.CreateDeliveryRequest;
import com.chaincheck.api.request.VerifyDeliveryRequest;
import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.error.SettlementInvariantException;
import com.chaincheck.ledger.DivinerResult;
import com.chaincheck.ledger.LocationProof;
import com.chaincheck.ledger.LocationProofPayload;
import com.chaincheck.model.Delivery;
import com.chaincheck.model.PaymentState;
import com.chaincheck.repository.DeliveryRepository;
import com.chaincheck.settlement.EscrowState;
import com.chaincheck.settlement.SettlementContext;
import com.chaincheck.settlement.SettlementResult;
import com.chaincheck.util.GeoDistance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Orchestrates a delivery from registration to settled payment.
 *
 * <p>Verification workflow:
 * <pre>
 * 1. Create the location proof (ProofService)
 *    - ledger unreachable → delivery stays IN_TRANSIT, retryable
 *    - any other failure  → delivery FAILED
 * 2. Query location consensus (non-critical)
 * 3. Mark the delivery DELIVERED with proof fields and distance to destination
 * 4. If payment is required on delivery, settle exactly once:
 *    - escrow enabled  → release the escrow
 *    - escrow disabled → direct transfer to the seller
 * </pre>
 *
 * <p>Database writes run in short transactions; proof creation and settlement run
 * outside of them. The delivery status is checked again under the row lock before each
 * write, so only the first verification of a delivery records its proof.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DeliveryPaymentStateMachine {

    private static final Set<DeliveryStatus> AWAITING_PROOF = EnumSet.of(
            DeliveryStatus.PENDING, DeliveryStatus.IN_TRANSIT);

    private final DeliveryRepository deliveryRepository;
    private final ProofService proofService;
    private final EscrowCoordinator escrowCoordinator;
    private final DirectTransferService directTransferService;
    private final PaymentTermsValidator paymentTermsValidator;
    private final SettlementContext settlementContext;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ==================== Delivery Operations ====================

    /**
     * Registers a delivery.
     *
     * @param request Delivery details and optional payment terms
     * @return Created delivery (PENDING, payment PENDING)
     * @throws IllegalStateException    if a delivery for the order already exists
     * @throws IllegalArgumentException if payment is required and its terms are invalid
     */
    public Delivery createDelivery(@Valid @NotNull CreateDeliveryRequest request) {
        if (request.requiresPaymentOnDelivery()) {
            paymentTermsValidator.validate(request.currency(), request.buyerAddress(),
                    request.sellerAddress(), request.amount());
        }

        return transactionTemplate.execute(status -> {
            if (deliveryRepository.existsByOrderId(request.orderId())) {
                throw new IllegalStateException("Delivery already exists for order " + request.orderId());
            }

            PaymentState paymentState = new PaymentState();
            paymentState.setRequiresPaymentOnDelivery(request.requiresPaymentOnDelivery());
            paymentState.setCurrency(request.currency() != null ? request.currency().toUpperCase() : null);
            paymentState.setBuyerAddress(request.buyerAddress());
            paymentState.setSellerAddress(request.sellerAddress());
            paymentState.setAmount(request.amount());
            paymentState.setPaymentStatus(PaymentStatus.PENDING);

            LocalDateTime now = LocalDateTime.now(clock);
            Delivery delivery = new Delivery();
            delivery.setOrderId(request.orderId());
            delivery.setDriverId(request.driverId());
            delivery.setRecipientName(request.recipientName());
            delivery.setRecipientPhone(request.recipientPhone());
            delivery.setDeliveryAddress(request.deliveryAddress());
            delivery.setDestinationLat(request.destinationLat());
            delivery.setDestinationLon(request.destinationLon());
            delivery.setStatus(DeliveryStatus.PENDING);
            delivery.setPaymentState(paymentState);
            delivery.setCreatedAt(now);
            delivery.setUpdatedAt(now);

            Delivery saved = deliveryRepository.save(delivery);
            log.info("Delivery {} created for order {} (driver={}, paymentRequired={})",
                    saved.getId(), saved.getOrderId(), saved.getDriverId(), request.requiresPaymentOnDelivery());
            return saved;
        });
    }

    /**
     * @throws EntityNotFoundException if the delivery does not exist
     */
    public Delivery getDelivery(UUID deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new EntityNotFoundException("Delivery not found: " + deliveryId));
    }

    /**
     * Verifies a delivery at the drop-off location and settles its payment.
     *
     * <p>Settlement failures do not fail the verification; they are reported in the
     * returned {@link DeliveryVerification#settlement()}. Verifying a DELIVERED delivery
     * again creates no proof: it returns the recorded proof and the recorded settlement,
     * or completes a settlement that has not happened yet.
     *
     * @param deliveryId Delivery ID
     * @param request    Location and sensor data
     * @return Proof, updated delivery, corroboration and settlement outcome
     * @throws EntityNotFoundException    if the delivery does not exist
     * @throws IllegalStateException      if the delivery is FAILED or DISPUTED
     * @throws LedgerUnavailableException if the witness ledger cannot be reached (retryable)
     */
    public DeliveryVerification verifyDelivery(UUID deliveryId, @Valid @NotNull VerifyDeliveryRequest request) {
        Delivery delivery = getDelivery(deliveryId);
        if (delivery.getStatus() == DeliveryStatus.DELIVERED) {
            log.info("Delivery {} already verified with proof {}", deliveryId, delivery.getProofHash());
            SettlementResult settlement = settle(delivery);
            return new DeliveryVerification(recordedProof(delivery), getDelivery(deliveryId), null, settlement);
        }
        requireAwaitingProof(delivery);

        long timestamp = request.timestamp() != null ? request.timestamp() : clock.millis();
        LocationProofPayload payload = new LocationProofPayload(
                delivery.getDriverId(),
                deliveryId,
                request.latitude(),
                request.longitude(),
                timestamp,
                request.altitude(),
                request.barometricPressure(),
                request.accelerometer(),
                request.photoHash(),
                request.signatureHash(),
                request.metadata());

        LocationProof proof;
        try {
            proof = proofService.createLocationProof(payload);
        } catch (LedgerUnavailableException e) {
            log.warn("Proof creation for delivery {} failed, ledger unavailable: {}", deliveryId, e.getMessage());
            recordProofFailure(deliveryId, DeliveryStatus.IN_TRANSIT,
                    "Proof creation failed (retryable): " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Proof creation for delivery {} failed: {}", deliveryId, e.getMessage(), e);
            recordProofFailure(deliveryId, DeliveryStatus.FAILED, "Proof creation failed: " + e.getMessage());
            throw e;
        }

        DivinerResult diviner = null;
        try {
            diviner = proofService.queryLocationDiviner(request.latitude(), request.longitude(), timestamp);
        } catch (RuntimeException e) {
            log.warn("Location consensus query for delivery {} failed: {}", deliveryId, e.getMessage());
        }

        Delivery delivered = markDelivered(deliveryId, proof, request);
        if (!proof.proofHash().equals(delivered.getProofHash())) {
            log.warn("Delivery {} was verified concurrently with proof {}; discarding proof {}",
                    deliveryId, delivered.getProofHash(), proof.proofHash());
            proof = recordedProof(delivered);
            diviner = null;
        }

        SettlementResult settlement = settle(delivered);
        return new DeliveryVerification(proof, getDelivery(deliveryId), diviner, settlement);
    }

    // ==================== Payment Operations ====================

    public Delivery getPaymentStatus(UUID deliveryId) {
        return getDelivery(deliveryId);
    }

    /**
     * On-chain escrow of a delivery; empty when escrow is disabled or none exists.
     *
     * @throws LedgerUnavailableException if the settlement chain cannot be reached
     */
    public Optional<EscrowState> getEscrowStatus(UUID deliveryId) {
        Delivery delivery = getDelivery(deliveryId);
        if (!settlementContext.escrowEnabled() || delivery.getEscrowDepositTxHash() == null) {
            return Optional.empty();
        }
        return escrowCoordinator.getEscrowStatus(deliveryId);
    }

    public boolean canAutoRefund(UUID deliveryId) {
        getDelivery(deliveryId);
        return settlementContext.escrowEnabled() && escrowCoordinator.canAutoRefund(deliveryId);
    }

    public SettlementResult depositEscrow(UUID deliveryId) {
        requireEscrow("deposit");
        getDelivery(deliveryId);
        return escrowCoordinator.deposit(deliveryId);
    }

    /**
     * Pays the seller: escrow release, or a direct transfer when escrow is disabled.
     * A delivery that is already paid returns its recorded transaction.
     */
    public SettlementResult releasePayment(UUID deliveryId) {
        Delivery delivery = getDelivery(deliveryId);
        if (!delivery.getPaymentState().isRequiresPaymentOnDelivery()) {
            return SettlementResult.noPaymentRequired();
        }
        return settlementContext.escrowEnabled()
                ? escrowCoordinator.release(deliveryId)
                : directTransferService.transfer(deliveryId);
    }

    public SettlementResult refundPayment(UUID deliveryId) {
        requireEscrow("refund");
        getDelivery(deliveryId);
        return escrowCoordinator.refund(deliveryId);
    }

    public SettlementResult autoRefund(UUID deliveryId) {
        requireEscrow("auto-refund");
        getDelivery(deliveryId);
        return escrowCoordinator.autoRefund(deliveryId);
    }

    /**
     * Auto-refunds escrows whose release deadline has passed without a release.
     *
     * @return Number of escrows refunded
     */
    public int autoRefundExpiredEscrows() {
        if (!settlementContext.escrowEnabled()) {
            return 0;
        }

        LocalDateTime depositedBefore = LocalDateTime.now(clock).minus(settlementContext.autoRefundWindow());
        int refunded = 0;
        for (UUID deliveryId : deliveryRepository.findEscrowedIdsCreatedBefore(PaymentStatus.ESCROWED, depositedBefore)) {
            try {
                if (!escrowCoordinator.canAutoRefund(deliveryId)) {
                    continue;
                }
                SettlementResult result = escrowCoordinator.autoRefund(deliveryId);
                if (result.success()) {
                    refunded++;
                } else if (!result.inProgress()) {
                    log.warn("Auto-refund of delivery {} failed: {}", deliveryId, result.error());
                }
            } catch (RuntimeException e) {
                log.error("Auto-refund of delivery {} failed: {}", deliveryId, e.getMessage(), e);
            }
        }
        return refunded;
    }

    // ==================== Internals ====================

    private SettlementResult settle(Delivery delivery) {
        if (!delivery.getPaymentState().isRequiresPaymentOnDelivery()) {
            return null;
        }
        try {
            return releasePayment(delivery.getId());
        } catch (RuntimeException e) {
            log.error("Settlement of delivery {} failed after verification: {}", delivery.getId(), e.getMessage(), e);
            return SettlementResult.failure(e.getMessage());
        }
    }

    /**
     * Returns the delivery unchanged when another verification already marked it DELIVERED.
     */
    private Delivery markDelivered(UUID deliveryId, LocationProof proof, VerifyDeliveryRequest request) {
        return transactionTemplate.execute(status -> {
            Delivery delivery = deliveryRepository.findByIdForUpdate(deliveryId)
                    .orElseThrow(() -> new EntityNotFoundException("Delivery not found: " + deliveryId));
            if (delivery.getStatus() == DeliveryStatus.DELIVERED) {
                return delivery;
            }
            requireAwaitingProof(delivery);
            LocalDateTime now = LocalDateTime.now(clock);

            delivery.setStatus(DeliveryStatus.DELIVERED);
            delivery.setProofHash(proof.proofHash());
            delivery.setBlockNumber(proof.ledgerBlockNumber());
            delivery.setWitnessRecord(writeJson(proof));
            delivery.setProofMocked(proof.mocked());
            delivery.setVerifiedAt(now);
            delivery.setActualLat(request.latitude());
            delivery.setActualLon(request.longitude());
            delivery.setDistanceFromDest(GeoDistance.haversineMeters(
                    request.latitude(), request.longitude(),
                    delivery.getDestinationLat(), delivery.getDestinationLon()));
            delivery.setUpdatedAt(now);

            log.info("Delivery {} DELIVERED: proof={}, mocked={}, distanceFromDest={}m",
                    deliveryId, proof.proofHash(), proof.mocked(), Math.round(delivery.getDistanceFromDest()));
            return deliveryRepository.save(delivery);
        });
    }

    private void recordProofFailure(UUID deliveryId, DeliveryStatus status, String note) {
        transactionTemplate.executeWithoutResult(tx -> deliveryRepository.findByIdForUpdate(deliveryId)
                .ifPresent(delivery -> {
                    if (!AWAITING_PROOF.contains(delivery.getStatus())) {
                        log.info("Delivery {} is {}; proof failure not recorded", deliveryId, delivery.getStatus());
                        return;
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    delivery.setStatus(status);
                    delivery.appendNote("[" + now + "] " + note);
                    delivery.setUpdatedAt(now);
                    deliveryRepository.save(delivery);
                }));
    }

    private String writeJson(LocationProof proof) {
        return proof.rawWitnessRecord() == null ? null : proof.rawWitnessRecord().toString();
    }

    private LocationProof recordedProof(Delivery delivery) {
        JsonNode witnessRecord = null;
        if (delivery.getWitnessRecord() != null) {
            try {
                witnessRecord = objectMapper.readTree(delivery.getWitnessRecord());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException(
                        "Stored witness record of delivery " + delivery.getId() + " is not valid JSON", e);
            }
        }
        return new LocationProof(delivery.getProofHash(), delivery.getBlockNumber(), witnessRecord,
                Boolean.TRUE.equals(delivery.getProofMocked()), null);
    }

    private static void requireAwaitingProof(Delivery delivery) {
        if (!AWAITING_PROOF.contains(delivery.getStatus())) {
            throw new IllegalStateException("Delivery " + delivery.getId() + " is already " + delivery.getStatus());
        }
    }

    private void requireEscrow(String operation) {
        if (!settlementContext.escrowEnabled()) {
            throw new SettlementInvariantException(
                    "Escrow is disabled: cannot " + operation + "; direct transfers are final");
        }
    }
}
