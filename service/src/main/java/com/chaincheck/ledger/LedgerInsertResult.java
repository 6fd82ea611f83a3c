package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of inserting a witness record into a ledger or the archival index.
 */
public record LedgerInsertResult(
        String hash,
        Long blockNumber,
        JsonNode record
) {
}
