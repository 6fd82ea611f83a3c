package com.chaincheck.api.response;

import java.util.List;

/**
 * Witness chain walked backwards from a starting record.
 */
public record WitnessChainResponse(
        String startHash,
        int maxDepth,
        int length,
        List<WitnessRecordResponse> records
) {
}
