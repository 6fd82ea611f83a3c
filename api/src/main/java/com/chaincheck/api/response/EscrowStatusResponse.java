package com.chaincheck.api.response;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * On-chain escrow view for a delivery.
 *
 * @param deliveryKey     keccak-256 key of the delivery id used by the contract
 * @param buyer           Depositor address
 * @param seller          Release target address
 * @param amount          Locked amount in ETH
 * @param released        Funds released to seller
 * @param refunded        Funds returned to buyer
 * @param createdAt       Escrow creation time
 * @param releaseDeadline Time after which anyone may trigger auto-refund
 * @param canAutoRefund   Whether auto-refund is currently possible
 */
public record EscrowStatusResponse(
        String deliveryKey,
        String buyer,
        String seller,
        BigDecimal amount,
        boolean released,
        boolean refunded,
        Instant createdAt,
        Instant releaseDeadline,
        boolean canAutoRefund
) {
}
