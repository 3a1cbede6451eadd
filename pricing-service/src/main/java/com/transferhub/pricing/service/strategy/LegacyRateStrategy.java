package com.transferhub.pricing.service.strategy;

import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.TierPrice;
import com.transferhub.pricing.service.LegacyRatePricer;
import com.transferhub.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(40)
@RequiredArgsConstructor
public class LegacyRateStrategy implements PricingStrategy {

    private final LegacyRatePricer legacyRatePricer;

    @Override
    public PricingTier tier() {
        return PricingTier.LEGACY_RATE;
    }

    @Override
    public String featureFlag() {
        return FeatureFlagService.LEGACY_RATE_RULES_ENABLED;
    }

    @Override
    public Optional<TierPrice> tryPrice(PricingContext context) {
        return context.reference().rateRuleFor(context.vehicleClassId())
                .map(rule -> TierPrice.of(tier(),
                        legacyRatePricer.price(context.distanceKm(), rule, context.flags()),
                        rule.getCurrency()));
    }
}
