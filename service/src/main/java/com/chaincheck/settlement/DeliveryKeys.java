package com.chaincheck.settlement;

import org.web3j.crypto.Hash;

import java.nio.charset.StandardCharsets;

/**
 * Escrow keys derived from delivery identifiers.
 */
public final class DeliveryKeys {

    private DeliveryKeys() {
    }

    /**
     * keccak-256 of the UTF-8 delivery identifier.
     *
     * @return 0x-prefixed 64-character hex string
     */
    public static String deterministicHash(String deliveryId) {
        return Hash.sha3String(deliveryId);
    }

    /**
     * Same key as {@link #deterministicHash(String)}, as the 32 raw bytes passed to the contract.
     */
    public static byte[] keyBytes(String deliveryId) {
        return Hash.sha3(deliveryId.getBytes(StandardCharsets.UTF_8));
    }
}
