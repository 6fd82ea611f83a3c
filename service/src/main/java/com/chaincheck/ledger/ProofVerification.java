package com.chaincheck.ledger;

import java.util.List;

/**
 * Result of looking a proof hash up in the prioritized sources.
 *
 * @param source ledger or archivist; null when no source had the record
 */
public record ProofVerification(
        String proofHash,
        boolean valid,
        String source,
        Long blockNumber,
        WitnessRecord record,
        List<String> errors
) {

    public static ProofVerification found(String proofHash, String source, WitnessRecord record) {
        Long blockNumber = record.committedBlockNumber().orElse(record.nbf());
        return new ProofVerification(proofHash, true, source, blockNumber, record, List.of());
    }

    public static ProofVerification notFound(String proofHash, List<String> errors) {
        return new ProofVerification(proofHash, false, null, null, null, List.copyOf(errors));
    }
}
