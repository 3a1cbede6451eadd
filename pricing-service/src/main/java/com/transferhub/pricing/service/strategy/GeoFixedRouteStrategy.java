package com.transferhub.pricing.service.strategy;

import com.transferhub.pricing.entity.GeoFixedRoute;
import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.TierPrice;
import com.transferhub.pricing.service.GeoMatcher;
import com.transferhub.shared.featureflag.FeatureFlagService;
import com.transferhub.shared.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tier 1. Needs both pickup and drop-off coordinates; the matched route price is used as-is.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class GeoFixedRouteStrategy implements PricingStrategy {

    private final GeoMatcher geoMatcher;

    @Override
    public PricingTier tier() {
        return PricingTier.GEO_FIXED_ROUTE;
    }

    @Override
    public String featureFlag() {
        return FeatureFlagService.GEO_FIXED_ROUTES_ENABLED;
    }

    @Override
    public Optional<TierPrice> tryPrice(PricingContext context) {
        if (!context.request().hasCoordinates()) {
            return Optional.empty();
        }
        Optional<GeoFixedRoute> match = geoMatcher.findMatch(
                context.request().pickupPoint(),
                context.request().dropoffPoint(),
                context.reference().geoRoutesFor(context.vehicleClassId()));

        return match.map(route -> new TierPrice(
                tier(), MoneyUtil.round(route.getPrice()), route.getCurrency(), route.getName()));
    }
}
