package com.transferhub.pricing.service.strategy;

import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingFlags;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.TierPrice;
import com.transferhub.shared.util.MoneyUtil;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Terminal tier: 25.00 + 1.80/km, +15.00 meet-and-greet, +10.00 airport pickup.
 * Always produces a price and cannot be switched off.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class DefaultFormulaStrategy implements PricingStrategy {

    static final BigDecimal BASE_FARE        = new BigDecimal("25.00");
    static final BigDecimal PER_KM_RATE      = new BigDecimal("1.80");
    static final BigDecimal MEET_GREET_FEE   = new BigDecimal("15.00");
    static final BigDecimal AIRPORT_FEE      = new BigDecimal("10.00");
    static final String     DEFAULT_CURRENCY = "GBP";

    @Override
    public PricingTier tier() {
        return PricingTier.DEFAULT_FORMULA;
    }

    @Override
    public Optional<TierPrice> tryPrice(PricingContext context) {
        return Optional.of(TierPrice.of(tier(), price(context.distanceKm(), context.flags()), DEFAULT_CURRENCY));
    }

    public BigDecimal price(double distanceKm, PricingFlags flags) {
        BigDecimal price = BASE_FARE.add(BigDecimal.valueOf(distanceKm).multiply(PER_KM_RATE));
        if (flags.meetGreet()) {
            price = price.add(MEET_GREET_FEE);
        }
        if (flags.airportPickup()) {
            price = price.add(AIRPORT_FEE);
        }
        return MoneyUtil.round(price);
    }
}
