package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Signed witness record and the payloads it witnesses, ready for submission.
 */
public record WitnessSubmission(
        String hash,
        JsonNode boundWitness,
        List<JsonNode> payloads,
        Long nbf
) {
}
