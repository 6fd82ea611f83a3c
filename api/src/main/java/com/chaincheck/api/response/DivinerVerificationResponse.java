package com.chaincheck.api.response;

import java.util.List;

/**
 * Location corroboration result from the consensus query (diviner) or its fallbacks.
 *
 * @param verified            Whether the location is corroborated
 * @param confidence          Confidence score 0..100
 * @param nodeCount           Number of witness nodes
 * @param consensusLevel      high, medium or low
 * @param consensus           Agreement ratio 0..1
 * @param locationMatch       Whether the observed location matches the claimed one
 * @param distanceFromClaimed Distance between observed and claimed location in meters
 * @param mocked              Whether the result was synthesized locally
 * @param source              diviner, ledger or mock
 * @param witnessNodes        Participating nodes
 */
public record DivinerVerificationResponse(
        boolean verified,
        int confidence,
        int nodeCount,
        String consensusLevel,
        double consensus,
        boolean locationMatch,
        Double distanceFromClaimed,
        boolean mocked,
        String source,
        List<WitnessNodeResponse> witnessNodes
) {
}
