package com.transferhub.pricing.service.strategy;

import com.transferhub.pricing.entity.LegacyTextRoute;
import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.TierPrice;
import com.transferhub.shared.featureflag.FeatureFlagService;
import com.transferhub.shared.util.MoneyUtil;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tier 2. First active text route (oldest first) whose labels overlap the request
 * and that carries a price for this vehicle class.
 */
@Component
@Order(20)
public class LegacyTextRouteStrategy implements PricingStrategy {

    @Override
    public PricingTier tier() {
        return PricingTier.LEGACY_TEXT_ROUTE;
    }

    @Override
    public String featureFlag() {
        return FeatureFlagService.LEGACY_TEXT_ROUTES_ENABLED;
    }

    @Override
    public Optional<TierPrice> tryPrice(PricingContext context) {
        String classId = context.vehicleClassId();
        for (LegacyTextRoute route : context.reference().textRoutes()) {
            if (route.isActive()
                    && route.hasPriceFor(classId)
                    && route.matches(context.request().getPickupLocation(), context.request().getDropoffLocation())) {
                return Optional.of(new TierPrice(
                        tier(), MoneyUtil.round(route.getPrices().get(classId)), route.getCurrency(), route.getName()));
            }
        }
        return Optional.empty();
    }
}
