package com.chaincheck.api.response;

import com.chaincheck.api.model.PaymentStatus;

import java.util.UUID;

/**
 * Outcome of a settlement operation (deposit, release, refund, auto-refund, transfer).
 *
 * <p>Failures are reported in the body rather than as HTTP errors: {@code success=false}
 * with {@code error} set. {@code inProgress=true} means a transaction was submitted (or
 * another request holds the settlement) and has not been confirmed yet.
 *
 * @param deliveryId      Delivery UUID
 * @param operation       Operation name
 * @param success         Whether the operation is confirmed
 * @param transactionHash Settlement transaction hash, if any
 * @param blockNumber     Block of the confirmed transaction
 * @param error           Failure reason
 * @param inProgress      Submitted but not yet confirmed
 * @param paymentStatus   Payment status after the operation
 */
public record SettlementResponse(
        UUID deliveryId,
        String operation,
        boolean success,
        String transactionHash,
        Long blockNumber,
        String error,
        boolean inProgress,
        PaymentStatus paymentStatus
) {
}
