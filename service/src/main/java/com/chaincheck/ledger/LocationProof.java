package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Proof created for a delivery. Mocked and real proofs have the same shape; only
 * {@code mocked} tells them apart.
 */
public record LocationProof(
        String proofHash,
        Long ledgerBlockNumber,
        JsonNode rawWitnessRecord,
        boolean mocked,
        String archivalHash
) {
}
