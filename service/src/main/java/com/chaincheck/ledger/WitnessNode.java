package com.chaincheck.ledger;

/**
 * Witness node that took part in a location corroboration.
 *
 * @param type bridge or sentinel
 */
public record WitnessNode(String address, String type, boolean verified) {
}
