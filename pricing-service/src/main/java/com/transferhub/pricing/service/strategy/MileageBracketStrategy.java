package com.transferhub.pricing.service.strategy;

import com.transferhub.pricing.entity.ExtraFees;
import com.transferhub.pricing.entity.PricingScheme;
import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingFlags;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.TierPrice;
import com.transferhub.pricing.service.BracketPricer;
import com.transferhub.shared.featureflag.FeatureFlagService;
import com.transferhub.shared.util.GeoUtil;
import com.transferhub.shared.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Tier 3. Bracket tariff of the class's active scheme, then the scheme's extra fees:
 *   subtotal = bracketPrice + airportPickupFee + meetGreetFee + childSeats * childSeatFee
 *   price    = subtotal + (nightPercent + weekendPercent) of subtotal
 */
@Component
@Order(30)
@RequiredArgsConstructor
public class MileageBracketStrategy implements PricingStrategy {

    private final BracketPricer bracketPricer;

    @Override
    public PricingTier tier() {
        return PricingTier.MILEAGE_BRACKET;
    }

    @Override
    public String featureFlag() {
        return FeatureFlagService.MILEAGE_BRACKETS_ENABLED;
    }

    @Override
    public Optional<TierPrice> tryPrice(PricingContext context) {
        Optional<PricingScheme> scheme = context.reference().schemeFor(context.vehicleClassId());
        if (scheme.isEmpty()) {
            return Optional.empty();
        }
        double miles = GeoUtil.kmToMiles(context.distanceKm());
        return bracketPricer.price(miles, scheme.get())
                .map(base -> TierPrice.of(tier(), applyExtras(base, scheme.get().fees(), context.flags()),
                        scheme.get().getCurrency()));
    }

    BigDecimal applyExtras(BigDecimal base, ExtraFees fees, PricingFlags flags) {
        BigDecimal price = base;
        if (flags.airportPickup()) {
            price = price.add(MoneyUtil.nullToZero(fees.getAirportPickupFee()));
        }
        if (flags.meetGreet()) {
            price = price.add(MoneyUtil.nullToZero(fees.getMeetGreetFee()));
        }
        if (flags.childSeats() > 0) {
            price = price.add(MoneyUtil.nullToZero(fees.getChildSeatFee()).multiply(BigDecimal.valueOf(flags.childSeats())));
        }

        BigDecimal percent = BigDecimal.ZERO;
        if (flags.night()) {
            percent = percent.add(MoneyUtil.nullToZero(fees.getNightSurchargePercent()));
        }
        if (flags.weekend()) {
            percent = percent.add(MoneyUtil.nullToZero(fees.getWeekendSurchargePercent()));
        }
        if (percent.signum() > 0) {
            price = price.add(MoneyUtil.percentOf(price, percent));
        }
        return MoneyUtil.round(price);
    }
}
