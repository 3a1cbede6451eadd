package com.transferhub.pricing.service;

import com.transferhub.pricing.entity.VehicleClass;
import com.transferhub.pricing.exception.PricingException;
import com.transferhub.pricing.metrics.PricingMetrics;
import com.transferhub.pricing.model.PricingContext;
import com.transferhub.pricing.model.PricingFlags;
import com.transferhub.pricing.model.PricingReferenceData;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.Quote;
import com.transferhub.pricing.model.QuoteRequest;
import com.transferhub.pricing.model.QuoteResponse;
import com.transferhub.pricing.model.TierPrice;
import com.transferhub.pricing.service.strategy.PricingStrategy;
import com.transferhub.shared.featureflag.FeatureFlagService;
import com.transferhub.shared.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a quote for every active vehicle class that fits the party.
 *
 * Each class walks the strategy chain (geo route, text route, mileage brackets,
 * legacy rate, default formula) and takes the first price offered. The default
 * formula is terminal, so every eligible class is always priced. Tiers can be
 * switched off through feature flags; when Redis is unreachable every tier stays on.
 */
@Slf4j
@Service
public class QuoteOrchestrator {

    static final String DEFAULT_CURRENCY = "GBP";

    private final List<PricingStrategy> chain;
    private final PricingReferenceService referenceService;
    private final PickupTimeClassifier timeClassifier;
    private final ObjectProvider<FeatureFlagService> featureFlags;
    private final PricingMetrics metrics;

    public QuoteOrchestrator(List<PricingStrategy> strategies,
                             PricingReferenceService referenceService,
                             PickupTimeClassifier timeClassifier,
                             ObjectProvider<FeatureFlagService> featureFlags,
                             PricingMetrics metrics) {
        List<PricingStrategy> sorted = new ArrayList<>(strategies);
        AnnotationAwareOrderComparator.sort(sorted);
        if (sorted.isEmpty() || sorted.get(sorted.size() - 1).tier() != PricingTier.DEFAULT_FORMULA) {
            throw new IllegalStateException("Pricing chain must end with the default formula, got " + sorted);
        }
        if (sorted.get(sorted.size() - 1).featureFlag() != null) {
            throw new IllegalStateException("The default formula tier cannot be behind a feature flag");
        }
        this.chain = List.copyOf(sorted);
        this.referenceService = referenceService;
        this.timeClassifier = timeClassifier;
        this.featureFlags = featureFlags;
        this.metrics = metrics;
        log.info("Pricing chain: {}", tierOrder());
    }

    public List<PricingTier> tierOrder() {
        return chain.stream().map(PricingStrategy::tier).toList();
    }

    public QuoteResponse quote(QuoteRequest request) {
        long start = System.nanoTime();
        try {
            PricingReferenceData reference = referenceService.loadSnapshot();
            PricingFlags flags = resolveFlags(request);
            Set<PricingTier> disabled = disabledTiers();

            List<Quote> quotes = new ArrayList<>();
            for (VehicleClass vehicleClass : reference.vehicleClasses()) {
                if (!vehicleClass.isActive()
                        || !vehicleClass.fits(request.getPassengers(), request.getLuggage())) {
                    continue;
                }
                TierPrice price = priceFor(new PricingContext(request, vehicleClass, flags, reference), disabled);
                quotes.add(toQuote(vehicleClass, price));
            }
            quotes.sort(Comparator.comparing(Quote::getPrice));

            String fixedRouteName = quotes.stream()
                    .filter(q -> q.getSourceTier() == PricingTier.GEO_FIXED_ROUTE)
                    .map(Quote::getRouteName)
                    .findFirst()
                    .orElse(null);

            log.info("Quoted {} vehicle classes for '{}' -> '{}' ({} km)",
                    quotes.size(), request.getPickupLocation(), request.getDropoffLocation(), request.getDistanceKm());

            return QuoteResponse.builder()
                    .quotes(quotes)
                    .distanceKm(request.getDistanceKm())
                    .durationMinutes((int) (request.getDistanceKm() * 2))
                    .pickupLocation(request.getPickupLocation())
                    .dropoffLocation(request.getDropoffLocation())
                    .fixedRoute(fixedRouteName != null)
                    .fixedRouteName(fixedRouteName)
                    .build();
        } finally {
            metrics.recordQuoteLatency(System.nanoTime() - start);
        }
    }

    /**
     * Prices one named class, rejecting unknown classes and parties that don't fit.
     */
    public Quote quoteForClass(QuoteRequest request, String vehicleClassId) {
        PricingReferenceData reference = referenceService.loadSnapshot();
        VehicleClass vehicleClass = reference.vehicleClass(vehicleClassId)
                .filter(VehicleClass::isActive)
                .orElseThrow(() -> new PricingException("VEHICLE_CLASS_NOT_FOUND",
                        "No active vehicle class: " + vehicleClassId));

        if (!vehicleClass.fits(request.getPassengers(), request.getLuggage())) {
            throw new PricingException("CAPACITY_EXCEEDED",
                    "%s carries at most %d passengers and %d bags".formatted(
                            vehicleClass.getName(), vehicleClass.getMaxPassengers(), vehicleClass.getMaxLuggage()));
        }

        PricingContext context = new PricingContext(request, vehicleClass, resolveFlags(request), reference);
        return toQuote(vehicleClass, priceFor(context, disabledTiers()));
    }

    TierPrice priceFor(PricingContext context, Set<PricingTier> disabled) {
        for (PricingStrategy strategy : chain) {
            if (disabled.contains(strategy.tier())) {
                continue;
            }
            var result = strategy.tryPrice(context);
            if (result.isPresent()) {
                TierPrice price = result.get();
                metrics.recordTier(price.tier());
                if (price.tier() == PricingTier.DEFAULT_FORMULA) {
                    metrics.recordUnconfigured();
                    log.debug("No pricing configured for class {}; default formula used", context.vehicleClassId());
                }
                return new TierPrice(price.tier(), MoneyUtil.round(price.price()),
                        price.currency() != null ? price.currency() : DEFAULT_CURRENCY, price.routeName());
            }
        }
        // unreachable: the terminal tier always prices and is never disabled
        throw new IllegalStateException("Pricing chain exhausted for class " + context.vehicleClassId());
    }

    PricingFlags resolveFlags(QuoteRequest request) {
        boolean night = timeClassifier.isNight(request.getPickupDateTime())
                && flagEnabled(FeatureFlagService.NIGHT_SURCHARGE_ENABLED);
        return new PricingFlags(
                request.isAirportPickup(),
                request.isMeetGreet(),
                night,
                timeClassifier.isWeekend(request.getPickupDateTime()),
                request.getChildSeats());
    }

    Set<PricingTier> disabledTiers() {
        Set<PricingTier> disabled = EnumSet.noneOf(PricingTier.class);
        for (PricingStrategy strategy : chain) {
            if (strategy.featureFlag() != null && !flagEnabled(strategy.featureFlag())) {
                disabled.add(strategy.tier());
            }
        }
        return disabled;
    }

    private boolean flagEnabled(String flag) {
        FeatureFlagService service = featureFlags.getIfAvailable();
        if (service == null) {
            return true;
        }
        try {
            return service.isEnabled(flag, true);
        } catch (DataAccessException e) {
            log.warn("Feature flag '{}' unreadable, treating as enabled: {}", flag, e.getMessage());
            return true;
        }
    }

    private Quote toQuote(VehicleClass vehicleClass, TierPrice price) {
        return Quote.builder()
                .vehicleClassId(vehicleClass.getId())
                .vehicleName(vehicleClass.getName())
                .price(price.price())
                .currency(price.currency())
                .sourceTier(price.tier())
                .routeName(price.routeName())
                .maxPassengers(vehicleClass.getMaxPassengers())
                .maxLuggage(vehicleClass.getMaxLuggage())
                .build();
    }
}
