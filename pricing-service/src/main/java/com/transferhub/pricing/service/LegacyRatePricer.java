package com.transferhub.pricing.service;

import com.transferhub.pricing.entity.LegacyRateRule;
import com.transferhub.pricing.model.PricingFlags;
import com.transferhub.shared.util.MoneyUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Flat per-kilometre fallback:
 *   price = baseFee + distanceKm * perKmRate (+ airportSurcharge) (+ meetGreetFee)
 *   night pickups add nightSurchargePercent of that
 *   result = max(price, minimumFare)
 */
@Component
public class LegacyRatePricer {

    public BigDecimal price(double distanceKm, LegacyRateRule rule, PricingFlags flags) {
        PricingFlags f = flags != null ? flags : PricingFlags.of(false, false);

        BigDecimal price = MoneyUtil.nullToZero(rule.getBaseFee())
                .add(BigDecimal.valueOf(distanceKm).multiply(MoneyUtil.nullToZero(rule.getPerKmRate())));

        if (f.airportPickup()) {
            price = price.add(MoneyUtil.nullToZero(rule.getAirportSurcharge()));
        }
        if (f.meetGreet()) {
            price = price.add(MoneyUtil.nullToZero(rule.getMeetGreetFee()));
        }
        if (f.night()) {
            price = price.add(MoneyUtil.percentOf(price, rule.getNightSurchargePercent()));
        }

        return MoneyUtil.round(price.max(MoneyUtil.nullToZero(rule.getMinimumFare())));
    }
}
