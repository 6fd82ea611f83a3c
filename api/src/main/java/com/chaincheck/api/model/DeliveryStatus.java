package com.chaincheck.api.model;

/**
 * Lifecycle status of a delivery.
 */
public enum DeliveryStatus {
    /**
     * PENDING: Delivery registered for an order, driver has not started.
     */
    PENDING,

    /**
     * IN_TRANSIT: Driver is on the way, or a verification attempt hit a transient
     * ledger failure and may be retried.
     */
    IN_TRANSIT,

    /**
     * DELIVERED: Location proof accepted. Proof hash and block number are recorded.
     * This is a final state for the delivery itself (payment may still progress).
     */
    DELIVERED,

    /**
     * FAILED: Verification failed for a non-transient reason.
     */
    FAILED,

    /**
     * DISPUTED: Delivery outcome contested by buyer or seller.
     */
    DISPUTED
}
