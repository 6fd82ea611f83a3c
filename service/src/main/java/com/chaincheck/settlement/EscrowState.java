package com.chaincheck.settlement;

import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * On-chain escrow, as returned by {@code getEscrow(bytes32)}.
 *
 * <p>At most one of {@code released} and {@code refunded} is ever true.
 */
public record EscrowState(
        String key,
        String buyer,
        String seller,
        BigInteger amountWei,
        boolean released,
        boolean refunded,
        Instant createdAt,
        Instant releaseDeadline
) {

    public boolean settled() {
        return released || refunded;
    }

    public BigDecimal amountEth() {
        return Convert.fromWei(new BigDecimal(amountWei), Convert.Unit.ETHER);
    }

    EscrowState markReleased() {
        return new EscrowState(key, buyer, seller, amountWei, true, false, createdAt, releaseDeadline);
    }

    EscrowState markRefunded() {
        return new EscrowState(key, buyer, seller, amountWei, false, true, createdAt, releaseDeadline);
    }
}
