package com.chaincheck.api;

import com.chaincheck.api.request.CreateDeliveryRequest;
import com.chaincheck.api.request.VerifyDeliveryRequest;
import com.chaincheck.api.response.DeliveryResponse;
import com.chaincheck.api.response.PaymentStateResponse;
import com.chaincheck.api.response.SettlementResponse;
import com.chaincheck.api.response.VerifyDeliveryResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Delivery API interface for delivery verification and payment settlement.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Delivery registration and lookup</li>
 *   <li>Proof-of-delivery verification (creates a location proof, settles payment)</li>
 *   <li>Escrow operations (deposit, release, refund, auto-refund)</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>DeliveryController - in service module (server-side implementation)</li>
 *   <li>DeliveryClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/deliveries")
public interface DeliveryApi {

    // ==================== Delivery Operations ====================

    /**
     * Registers a delivery for an order.
     *
     * @param request Delivery details and optional payment terms
     * @return Created delivery
     */
    @PostMapping
    ResponseEntity<DeliveryResponse> createDelivery(
            @Valid @RequestBody CreateDeliveryRequest request);

    /**
     * Gets a delivery by ID.
     *
     * @param deliveryId The delivery ID
     * @return Delivery with payment state
     */
    @GetMapping("/{deliveryId}")
    ResponseEntity<DeliveryResponse> getDelivery(
            @PathVariable("deliveryId") UUID deliveryId);

    /**
     * Verifies a delivery at the drop-off location.
     *
     * <p>Creates a location proof, marks the delivery DELIVERED and settles the
     * payment once when the delivery requires payment on delivery. A delivery that is
     * already DELIVERED returns its recorded proof and settlement.
     *
     * @param deliveryId The delivery ID
     * @param request    Location and sensor data captured by the driver
     * @return Proof, updated delivery and settlement outcome
     */
    @PostMapping("/{deliveryId}/verify")
    ResponseEntity<VerifyDeliveryResponse> verifyDelivery(
            @PathVariable("deliveryId") UUID deliveryId,
            @Valid @RequestBody VerifyDeliveryRequest request);

    // ==================== Payment Operations ====================

    /**
     * Gets the payment state of a delivery, including the on-chain escrow when available.
     *
     * @param deliveryId The delivery ID
     * @return Payment state
     */
    @GetMapping("/{deliveryId}/payment")
    ResponseEntity<PaymentStateResponse> getPaymentStatus(
            @PathVariable("deliveryId") UUID deliveryId);

    /**
     * Locks the delivery amount in escrow. Fails with 409 when an escrow already exists.
     *
     * @param deliveryId The delivery ID
     * @return Settlement outcome
     */
    @PostMapping("/{deliveryId}/payment/deposit")
    ResponseEntity<SettlementResponse> depositEscrow(
            @PathVariable("deliveryId") UUID deliveryId);

    /**
     * Releases the payment to the seller. Idempotent: a paid delivery returns its
     * recorded transaction.
     *
     * @param deliveryId The delivery ID
     * @return Settlement outcome
     */
    @PostMapping("/{deliveryId}/payment/release")
    ResponseEntity<SettlementResponse> releasePayment(
            @PathVariable("deliveryId") UUID deliveryId);

    /**
     * Refunds the escrowed payment to the buyer.
     *
     * @param deliveryId The delivery ID
     * @return Settlement outcome
     */
    @PostMapping("/{deliveryId}/payment/refund")
    ResponseEntity<SettlementResponse> refundPayment(
            @PathVariable("deliveryId") UUID deliveryId);

    /**
     * Refunds the escrowed payment after the release deadline has passed.
     *
     * @param deliveryId The delivery ID
     * @return Settlement outcome
     */
    @PostMapping("/{deliveryId}/payment/auto-refund")
    ResponseEntity<SettlementResponse> autoRefund(
            @PathVariable("deliveryId") UUID deliveryId);
}
