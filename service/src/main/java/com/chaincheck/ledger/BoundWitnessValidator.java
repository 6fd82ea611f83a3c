package com.chaincheck.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks shared by the ledger adapters.
 */
public final class BoundWitnessValidator {

    private static final List<String> REQUIRED_FIELDS =
            List.of("schema", "payload_hashes", "addresses", "previous_hashes");

    private BoundWitnessValidator() {
    }

    public static ProofValidationResult validate(JsonNode boundWitness) {
        List<String> errors = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (!boundWitness.has(field)) {
                errors.add("Missing " + field + " field");
            }
        }

        JsonNode addresses = boundWitness.path("addresses");
        JsonNode signatures = boundWitness.has("$signatures")
                ? boundWitness.path("$signatures")
                : boundWitness.path("_signatures");
        if (addresses.isArray() && addresses.isEmpty()) {
            errors.add("No addresses found in bound witness");
        } else if (!signatures.isArray() || signatures.isEmpty()) {
            errors.add("No signatures found in bound witness");
        } else if (addresses.isArray() && signatures.size() != addresses.size()) {
            errors.add("Signature count (" + signatures.size() + ") does not match address count ("
                    + addresses.size() + ")");
        }
        return ProofValidationResult.of(errors);
    }
}
