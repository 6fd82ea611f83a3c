package com.chaincheck.api.response;

/**
 * Witness node that took part in a location corroboration.
 */
public record WitnessNodeResponse(
        String address,
        String type,
        boolean verified
) {
}
