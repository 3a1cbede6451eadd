package com.transferhub.pricing.model;

import com.transferhub.pricing.entity.GeoFixedRoute;
import com.transferhub.pricing.entity.LegacyRateRule;
import com.transferhub.pricing.entity.LegacyTextRoute;
import com.transferhub.pricing.entity.PricingScheme;
import com.transferhub.pricing.entity.VehicleClass;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of every table the quote engine consults, loaded once per request.
 */
public record PricingReferenceData(List<VehicleClass> vehicleClasses,
                                   Map<String, PricingScheme> schemesByClass,
                                   Map<String, List<GeoFixedRoute>> geoRoutesByClass,
                                   List<LegacyTextRoute> textRoutes,
                                   Map<String, LegacyRateRule> rateRulesByClass) {

    public Optional<VehicleClass> vehicleClass(String vehicleClassId) {
        return vehicleClasses.stream()
                .filter(vc -> vc.getId().equals(vehicleClassId))
                .findFirst();
    }

    public Optional<PricingScheme> schemeFor(String vehicleClassId) {
        return Optional.ofNullable(schemesByClass.get(vehicleClassId));
    }

    public List<GeoFixedRoute> geoRoutesFor(String vehicleClassId) {
        return geoRoutesByClass.getOrDefault(vehicleClassId, List.of());
    }

    public Optional<LegacyRateRule> rateRuleFor(String vehicleClassId) {
        return Optional.ofNullable(rateRulesByClass.get(vehicleClassId));
    }
}
