package com.transferhub.pricing.service;

import com.transferhub.pricing.entity.MileageBracket;
import com.transferhub.pricing.entity.PricingScheme;
import com.transferhub.shared.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Cumulative mileage-bracket tariff.
 *
 * Formula, brackets in ascending order, running total starting at baseFare:
 *   milesInBracket = min(distance, maxMiles ?: distance) - minMiles   (skip if <= 0)
 *   first bracket (minMiles == 0) with fixedPrice -> total = fixedPrice   (flat first N miles)
 *   perMileRate set                               -> total += milesInBracket * perMileRate
 *   later bracket with fixedPrice                 -> total += fixedPrice
 *   price = max(total, minimumFare)
 *
 * Request extras (airport, meet-and-greet) are the caller's concern.
 */
@Slf4j
@Component
public class BracketPricer {

    public Optional<BigDecimal> price(double distanceMiles, PricingScheme scheme) {
        if (scheme == null || !scheme.hasBrackets()) {
            return Optional.empty();
        }
        if (scheme.hasOverlappingBrackets()) {
            log.warn("Pricing scheme {} (class={}) has overlapping mileage brackets",
                    scheme.getId(), scheme.getVehicleClassId());
        }

        BigDecimal total = MoneyUtil.nullToZero(scheme.getBaseFare());

        for (MileageBracket bracket : scheme.orderedBrackets()) {
            if (distanceMiles < bracket.getMinMiles()) {
                continue;
            }
            double upper = bracket.getMaxMiles() != null
                    ? Math.min(distanceMiles, bracket.getMaxMiles())
                    : distanceMiles;
            double milesInBracket = upper - bracket.getMinMiles();
            if (milesInBracket <= 0) {
                continue;
            }

            if (bracket.isFirst() && bracket.getFixedPrice() != null) {
                total = bracket.getFixedPrice();
            } else if (bracket.getPerMileRate() != null) {
                total = total.add(BigDecimal.valueOf(milesInBracket).multiply(bracket.getPerMileRate()));
            } else if (bracket.getFixedPrice() != null) {
                total = total.add(bracket.getFixedPrice());
            } else {
                log.warn("Bracket order={} of scheme {} has neither fixedPrice nor perMileRate; no price delta applied",
                        bracket.getOrder(), scheme.getId());
            }
        }

        BigDecimal price = total.max(MoneyUtil.nullToZero(scheme.getMinimumFare()));
        log.debug("Bracket price: scheme={} miles={} total={} -> {}", scheme.getId(), distanceMiles, total, price);
        return Optional.of(MoneyUtil.round(price));
    }
}
