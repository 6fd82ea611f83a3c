package com.chaincheck.api.model;

/**
 * Payment status of a delivery.
 *
 * <p>Transitions:
 * <pre>
 * PENDING → ESCROWED → PAID
 *                    → REFUNDED
 * any non-final      → FAILED
 * FAILED             → ESCROWED (manual retry)
 * </pre>
 */
public enum PaymentStatus {
    /**
     * PENDING: No funds locked yet.
     */
    PENDING,

    /**
     * ESCROWED: Funds locked in the custodial contract (or a direct transfer is in flight).
     */
    ESCROWED,

    /**
     * PAID: Funds delivered to the seller. Final.
     */
    PAID,

    /**
     * FAILED: Last settlement attempt failed. Error is recorded on the payment.
     */
    FAILED,

    /**
     * REFUNDED: Funds returned to the buyer. Final.
     */
    REFUNDED
}
