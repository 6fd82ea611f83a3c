package com.chaincheck.ledger;

import java.util.List;

/**
 * Structural validation outcome of a witness record.
 */
public record ProofValidationResult(boolean valid, List<String> errors) {

    public static ProofValidationResult of(List<String> errors) {
        return new ProofValidationResult(errors.isEmpty(), List.copyOf(errors));
    }

    public static ProofValidationResult invalid(String error) {
        return new ProofValidationResult(false, List.of(error));
    }
}
