package com.chaincheck.api.response;

import java.util.List;

/**
 * Result of verifying a proof hash against the ledger and the archival index.
 *
 * @param proofHash   Verified hash
 * @param valid       Whether a witness record was found
 * @param source      ledger or archivist (null when invalid)
 * @param blockNumber Block number of the record, when known
 * @param record      The witness record, when found
 * @param errors      Reasons collected from every source that failed
 */
public record ProofVerificationResponse(
        String proofHash,
        boolean valid,
        String source,
        Long blockNumber,
        WitnessRecordResponse record,
        List<String> errors
) {
}
