package com.chaincheck.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * Accelerometer reading captured on the driver's device at proof time.
 */
public record Accelerometer(
        @NotNull Double x,
        @NotNull Double y,
        @NotNull Double z
) {
}
