package com.chaincheck.ledger;

import java.util.List;

/**
 * Location corroboration result.
 *
 * @param confidence     Confidence score 0..100
 * @param consensusLevel high (&gt;= 90), medium (&gt;= 70) or low
 * @param consensus      Agreement ratio between witnesses, 0..1
 * @param source         diviner, ledger or mock
 */
public record DivinerResult(
        boolean verified,
        int confidence,
        int nodeCount,
        String consensusLevel,
        double consensus,
        boolean locationMatch,
        Double distanceFromClaimed,
        boolean mocked,
        String source,
        List<WitnessNode> witnessNodes
) {

    public static String consensusLevel(int confidence) {
        if (confidence >= 90) {
            return "high";
        }
        return confidence >= 70 ? "medium" : "low";
    }
}
