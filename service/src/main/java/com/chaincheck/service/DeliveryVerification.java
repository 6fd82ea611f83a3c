package com.chaincheck.service;

import com.chaincheck.ledger.DivinerResult;
import com.chaincheck.ledger.LocationProof;
import com.chaincheck.model.Delivery;
import com.chaincheck.settlement.SettlementResult;

/**
 * Outcome of verifying a delivery.
 *
 * @param proof      Location proof created for the delivery
 * @param delivery   Delivery after verification and settlement
 * @param diviner    Location corroboration; null when the query failed
 * @param settlement Settlement outcome; null when the delivery requires no payment
 */
public record DeliveryVerification(
        LocationProof proof,
        Delivery delivery,
        DivinerResult diviner,
        SettlementResult settlement
) {
}
