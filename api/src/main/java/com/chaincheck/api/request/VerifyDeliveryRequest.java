package com.chaincheck.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * Request DTO for verifying a delivery at the drop-off location.
 *
 * @param latitude           Latitude where the driver claims delivery
 * @param longitude          Longitude where the driver claims delivery
 * @param timestamp          Capture time in epoch milliseconds (server time when absent)
 * @param altitude           Optional altitude in meters
 * @param barometricPressure Optional barometric pressure in hPa
 * @param accelerometer      Optional accelerometer reading
 * @param photoHash          Optional SHA-256 hash of the delivery photo
 * @param signatureHash      Optional SHA-256 hash of the recipient signature
 * @param metadata           Free-form metadata carried into the witness payload
 */
public record VerifyDeliveryRequest(
        @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
        @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
        Double latitude,

        @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
        @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
        Double longitude,

        Long timestamp,

        Double altitude,

        Double barometricPressure,

        @Valid
        Accelerometer accelerometer,

        @Pattern(regexp = "^[a-fA-F0-9]{64}$", message = "Photo hash must be a SHA-256 hex digest")
        String photoHash,

        @Pattern(regexp = "^[a-fA-F0-9]{64}$", message = "Signature hash must be a SHA-256 hex digest")
        String signatureHash,

        Map<String, String> metadata
) {
}
