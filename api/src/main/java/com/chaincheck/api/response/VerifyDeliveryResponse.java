package com.chaincheck.api.response;

/**
 * Result of verifying a delivery: the created proof, the updated delivery and,
 * when applicable, the corroboration and settlement outcomes.
 */
public record VerifyDeliveryResponse(
        LocationProofResponse proof,
        DeliveryResponse delivery,
        DivinerVerificationResponse diviner,
        SettlementResponse settlement
) {
}
