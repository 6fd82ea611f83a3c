package com.chaincheck.api.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for registering a delivery for an order.
 *
 * <p>Payment fields are only required when {@code requiresPaymentOnDelivery} is true;
 * the service rejects incomplete payment data in that case.
 *
 * @param orderId                   External order reference (unique)
 * @param driverId                  Driver assigned to the delivery
 * @param recipientName             Recipient name
 * @param recipientPhone            Recipient phone number
 * @param deliveryAddress           Destination address (free text)
 * @param destinationLat            Destination latitude
 * @param destinationLon            Destination longitude
 * @param requiresPaymentOnDelivery Whether payment is settled when the delivery is verified
 * @param currency                  Settlement currency (only ETH is supported)
 * @param buyerAddress              Buyer Ethereum address (refund target)
 * @param sellerAddress             Seller Ethereum address (release target)
 * @param amount                    Amount in ETH
 */
public record CreateDeliveryRequest(
        @NotBlank(message = "Order ID is required")
        @Size(max = 100, message = "Order ID must be at most 100 characters")
        String orderId,

        @NotBlank(message = "Driver ID is required")
        String driverId,

        @NotBlank(message = "Recipient name is required")
        String recipientName,

        String recipientPhone,

        @NotBlank(message = "Delivery address is required")
        String deliveryAddress,

        @NotNull(message = "Destination latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
        @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
        Double destinationLat,

        @NotNull(message = "Destination longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
        @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
        Double destinationLon,

        boolean requiresPaymentOnDelivery,

        String currency,

        @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "Buyer address must be a valid Ethereum address")
        String buyerAddress,

        @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "Seller address must be a valid Ethereum address")
        String sellerAddress,

        @Positive(message = "Amount must be positive")
        BigDecimal amount
) {
}
