package com.chaincheck.settlement;

import com.chaincheck.model.SettlementOperation;

/**
 * Transaction accepted by the chain, not yet confirmed.
 */
public record SubmittedTransaction(String transactionHash, SettlementOperation operation) {
}
