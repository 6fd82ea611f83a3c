package com.chaincheck.api.response;

import java.util.List;

/**
 * Structural validation result of a witness record held by the archival index.
 */
public record ValidationResponse(
        String proofHash,
        boolean valid,
        List<String> errors
) {
}
