package com.transferhub.pricing.service;

import com.transferhub.pricing.entity.GeoFixedRoute;
import com.transferhub.pricing.entity.LegacyRateRule;
import com.transferhub.pricing.entity.PricingScheme;
import com.transferhub.pricing.model.PricingReferenceData;
import com.transferhub.pricing.repository.GeoFixedRouteRepository;
import com.transferhub.pricing.repository.LegacyRateRuleRepository;
import com.transferhub.pricing.repository.LegacyTextRouteRepository;
import com.transferhub.pricing.repository.PricingSchemeRepository;
import com.transferhub.pricing.repository.VehicleClassRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads the pricing tables in one read-only transaction so a single quote sees one
 * consistent view, whatever the admin side does concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingReferenceService {

    private final VehicleClassRepository vehicleClassRepository;
    private final PricingSchemeRepository pricingSchemeRepository;
    private final GeoFixedRouteRepository geoFixedRouteRepository;
    private final LegacyTextRouteRepository legacyTextRouteRepository;
    private final LegacyRateRuleRepository legacyRateRuleRepository;

    @Transactional(readOnly = true)
    public PricingReferenceData loadSnapshot() {
        Map<String, PricingScheme> schemes = new HashMap<>();
        for (PricingScheme scheme : pricingSchemeRepository.findByActiveTrueOrderByCreatedAtAsc()) {
            PricingScheme kept = schemes.putIfAbsent(scheme.getVehicleClassId(), scheme);
            if (kept != null) {
                log.warn("Vehicle class {} has more than one active pricing scheme; using {} and ignoring {}",
                        scheme.getVehicleClassId(), kept.getId(), scheme.getId());
            }
        }

        Map<String, List<GeoFixedRoute>> geoRoutes = geoFixedRouteRepository
                .findByActiveTrueOrderByPriorityDescCreatedAtAsc().stream()
                .collect(Collectors.groupingBy(GeoFixedRoute::getVehicleClassId, LinkedHashMap::new, Collectors.toList()));

        Map<String, LegacyRateRule> rateRules = legacyRateRuleRepository.findAll().stream()
                .collect(Collectors.toMap(LegacyRateRule::getVehicleClassId, r -> r, (a, b) -> a));

        return new PricingReferenceData(
                vehicleClassRepository.findByActiveTrueOrderBySortOrderAsc(),
                schemes,
                geoRoutes,
                legacyTextRouteRepository.findByActiveTrueOrderByCreatedAtAsc(),
                rateRules);
    }
}
