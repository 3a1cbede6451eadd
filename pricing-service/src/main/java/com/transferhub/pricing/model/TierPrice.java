package com.transferhub.pricing.model;

import java.math.BigDecimal;

/**
 * Price produced by one pricing strategy. {@code routeName} is set only by the route tiers.
 */
public record TierPrice(PricingTier tier, BigDecimal price, String currency, String routeName) {

    public static TierPrice of(PricingTier tier, BigDecimal price, String currency) {
        return new TierPrice(tier, price, currency, null);
    }
}
