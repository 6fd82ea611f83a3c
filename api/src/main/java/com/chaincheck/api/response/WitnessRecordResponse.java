package com.chaincheck.api.response;

import java.util.List;

/**
 * Bound-witness record as stored on the proof ledger.
 *
 * @param hash           Record hash
 * @param schema         Record schema
 * @param addresses      Witness addresses
 * @param payloadHashes  Hashes of the witnessed payloads
 * @param payloadSchemas Schemas of the witnessed payloads
 * @param previousHashes Previous record per address (entries may be null)
 * @param signatures     Signatures per address
 * @param nbf            Not-before block number
 * @param exp            Expiry block number
 * @param blockNumber    Block the record was committed in, when known
 */
public record WitnessRecordResponse(
        String hash,
        String schema,
        List<String> addresses,
        List<String> payloadHashes,
        List<String> payloadSchemas,
        List<String> previousHashes,
        List<String> signatures,
        Long nbf,
        Long exp,
        Long blockNumber
) {
}
