package com.transferhub.pricing.service.strategy;

import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.TierPrice;

import java.util.Optional;

/**
 * One tier of the quote fallback chain. Implementations are ordered with {@code @Order};
 * the first one returning a price for a vehicle class wins.
 */
public interface PricingStrategy {

    PricingTier tier();

    /**
     * @return a price when this tier is configured for the context's vehicle class, empty to fall through
     */
    Optional<TierPrice> tryPrice(PricingContext context);

    /**
     * Feature flag that can switch this tier off, or null when the tier is always on.
     */
    default String featureFlag() {
        return null;
    }
}
