package com.chaincheck.api.response;

import com.chaincheck.api.model.DeliveryStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a delivery and its payment state.
 *
 * @param id               Delivery UUID
 * @param orderId          External order reference
 * @param driverId         Assigned driver
 * @param recipientName    Recipient name
 * @param recipientPhone   Recipient phone
 * @param deliveryAddress  Destination address
 * @param destinationLat   Destination latitude
 * @param destinationLon   Destination longitude
 * @param status           Delivery status
 * @param proofHash        Location proof hash (null until verified)
 * @param blockNumber      Ledger block number of the proof
 * @param proofMocked      Whether the proof was synthesized locally
 * @param verifiedAt       Verification timestamp
 * @param actualLat        Latitude reported at verification
 * @param actualLon        Longitude reported at verification
 * @param distanceFromDest Distance from destination in meters
 * @param notes            Operator notes (transient failures are appended here)
 * @param payment          Payment state
 * @param createdAt        Creation timestamp
 * @param updatedAt        Last update timestamp
 */
public record DeliveryResponse(
        UUID id,
        String orderId,
        String driverId,
        String recipientName,
        String recipientPhone,
        String deliveryAddress,
        Double destinationLat,
        Double destinationLon,
        DeliveryStatus status,
        String proofHash,
        Long blockNumber,
        Boolean proofMocked,
        LocalDateTime verifiedAt,
        Double actualLat,
        Double actualLon,
        Double distanceFromDest,
        String notes,
        PaymentStateResponse payment,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
