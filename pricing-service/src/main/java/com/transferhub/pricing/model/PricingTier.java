package com.transferhub.pricing.model;

/**
 * Where a quoted price came from, in fallback order.
 */
public enum PricingTier {
    GEO_FIXED_ROUTE,
    LEGACY_TEXT_ROUTE,
    MILEAGE_BRACKET,
    LEGACY_RATE,
    DEFAULT_FORMULA
}
