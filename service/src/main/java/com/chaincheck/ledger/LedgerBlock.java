package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Ledger block with the hashes of the transactions it contains.
 */
public record LedgerBlock(
        long number,
        String hash,
        List<String> transactionHashes,
        JsonNode raw
) {

    public boolean containsTransaction(String transactionHash) {
        return transactionHashes.stream().anyMatch(transactionHash::equalsIgnoreCase);
    }
}
