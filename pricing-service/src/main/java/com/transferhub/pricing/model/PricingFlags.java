package com.transferhub.pricing.model;

/**
 * Request-level switches that add fees or surcharges on top of a tier's base price.
 * {@code night} and {@code weekend} are already resolved from the pickup time.
 */
public record PricingFlags(boolean airportPickup,
                           boolean meetGreet,
                           boolean night,
                           boolean weekend,
                           int childSeats) {

    public static PricingFlags of(boolean airportPickup, boolean meetGreet) {
        return new PricingFlags(airportPickup, meetGreet, false, false, 0);
    }
}
