package com.chaincheck.api.response;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Location proof created for a delivery.
 *
 * @param proofHash         Witness record hash
 * @param ledgerBlockNumber Ledger block number the record was submitted against
 * @param mocked            Whether the proof was synthesized locally
 * @param archivalHash      Hash returned by the archival index, if the copy succeeded
 * @param rawWitnessRecord  Raw witness record JSON
 */
public record LocationProofResponse(
        String proofHash,
        Long ledgerBlockNumber,
        boolean mocked,
        String archivalHash,
        JsonNode rawWitnessRecord
) {
}
