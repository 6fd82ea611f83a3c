package com.chaincheck.ledger;

import com.chaincheck.api.request.Accelerometer;

import java.util.Map;
import java.util.UUID;

/**
 * Location and sensor data witnessed by a proof.
 *
 * @param timestamp Epoch milliseconds
 */
public record LocationProofPayload(
        String driverId,
        UUID deliveryId,
        double latitude,
        double longitude,
        long timestamp,
        Double altitude,
        Double barometricPressure,
        Accelerometer accelerometer,
        String photoHash,
        String signatureHash,
        Map<String, String> metadata
) {
}
