package com.chaincheck.ledger;

/**
 * Confirmation of a mined transaction.
 *
 * @param transactionHash Transaction hash
 * @param blockNumber     Block the transaction was mined in
 * @param success         False when the transaction reverted
 * @param revertReason    Revert reason reported by the chain, if any
 */
public record ChainReceipt(
        String transactionHash,
        Long blockNumber,
        boolean success,
        String revertReason
) {
}
