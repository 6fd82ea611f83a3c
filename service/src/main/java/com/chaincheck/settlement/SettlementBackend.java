package com.chaincheck.settlement;

import com.chaincheck.error.LedgerUnavailableException;
import com.chaincheck.error.SettlementRevertedException;
import com.chaincheck.ledger.ChainReceipt;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;

/**
 * Settlement chain and escrow contract, selected once at start-up (mock or live).
 *
 * <p>Submit methods return as soon as the chain accepts the transaction. They throw
 * {@link SettlementRevertedException} when the contract rejects the call and
 * {@link LedgerUnavailableException} when the chain cannot be reached.
 */
public interface SettlementBackend {

    boolean isMock();

    /**
     * Escrow contract address recorded on deliveries; null when there is none.
     */
    String contractAddress();

    SubmittedTransaction submitDeposit(String deliveryId, String sellerAddress, BigInteger amountWei);

    SubmittedTransaction submitRelease(String deliveryId);

    SubmittedTransaction submitRefund(String deliveryId);

    SubmittedTransaction submitAutoRefund(String deliveryId);

    /**
     * Plain value transfer from the settlement authority, used when escrow is disabled.
     */
    SubmittedTransaction submitTransfer(String toAddress, BigInteger amountWei);

    /**
     * Waits for a receipt.
     *
     * @return Receipt; empty when the wait timed out
     */
    Optional<ChainReceipt> awaitReceipt(String transactionHash, Duration timeout);

    /**
     * Receipt lookup without waiting.
     */
    Optional<ChainReceipt> getReceipt(String transactionHash);

    Optional<EscrowState> getEscrow(String deliveryId);

    boolean canAutoRefund(String deliveryId);
}
