package com.chaincheck.service;

import com.chaincheck.model.Delivery;
import com.chaincheck.settlement.SettlementResult;

/**
 * Outcome of trying to claim the settlement of a delivery.
 *
 * @param status   What the caller should do next
 * @param delivery Delivery as seen by the claim transaction
 * @param result   Recorded result when {@code status} is SETTLED
 */
public record SettlementClaim(Status status, Delivery delivery, SettlementResult result) {

    public enum Status {
        /** Caller owns the settlement and may submit. */
        ACQUIRED,
        /** Nothing to submit; {@code result} holds the recorded outcome. */
        SETTLED,
        /** Another request owns the settlement. */
        BUSY,
        /** Caller owns the settlement of an already submitted transaction and must confirm it. */
        RESUME
    }

    static SettlementClaim acquired(Delivery delivery) {
        return new SettlementClaim(Status.ACQUIRED, delivery, null);
    }

    static SettlementClaim settled(Delivery delivery, SettlementResult result) {
        return new SettlementClaim(Status.SETTLED, delivery, result);
    }

    static SettlementClaim busy(Delivery delivery) {
        return new SettlementClaim(Status.BUSY, delivery, null);
    }

    static SettlementClaim resume(Delivery delivery) {
        return new SettlementClaim(Status.RESUME, delivery, null);
    }
}
