package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Write and lookup access to a store of witness records.
 *
 * <p>Implementations do not fall back to each other; prioritization between stores is
 * the caller's concern.
 */
public interface ProofLedgerAdapter {

    LedgerInsertResult insert(WitnessSubmission submission);

    Optional<JsonNode> fetch(String hash);

    ProofValidationResult validate(String hash);
}
