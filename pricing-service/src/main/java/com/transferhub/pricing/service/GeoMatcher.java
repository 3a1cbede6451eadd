package com.transferhub.pricing.service;

import com.transferhub.pricing.entity.GeoFixedRoute;
import com.transferhub.pricing.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Geofenced fixed-route lookup.
 *
 * Routes are ranked by priority (desc), then creation time (asc), then id, and the
 * first route whose zones contain pickup/drop-off wins. A route flagged validReturn
 * is also tried end-to-start before moving on. Overlapping zones are resolved by
 * priority alone; a smaller radius gets no precedence.
 */
@Slf4j
@Component
public class GeoMatcher {

    static final Comparator<GeoFixedRoute> EVALUATION_ORDER =
            Comparator.<GeoFixedRoute>comparingInt(GeoFixedRoute::getPriority).reversed()
                    .thenComparing(GeoFixedRoute::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                    .thenComparing(GeoFixedRoute::getId, Comparator.nullsLast(Comparator.<UUID>naturalOrder()));

    public Optional<GeoFixedRoute> findMatch(GeoPoint pickup, GeoPoint dropoff, Collection<GeoFixedRoute> routes) {
        if (pickup == null || dropoff == null || routes == null || routes.isEmpty()) {
            return Optional.empty();
        }

        for (GeoFixedRoute route : rank(routes)) {
            if (route.getStart().contains(pickup) && route.getEnd().contains(dropoff)) {
                log.debug("Geo route '{}' matched (priority={})", route.getName(), route.getPriority());
                return Optional.of(route);
            }
            if (route.isValidReturn() && route.getEnd().contains(pickup) && route.getStart().contains(dropoff)) {
                log.debug("Geo route '{}' matched on return leg (priority={})", route.getName(), route.getPriority());
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    /**
     * Active, fully-configured routes in the order they are evaluated.
     */
    public List<GeoFixedRoute> rank(Collection<GeoFixedRoute> routes) {
        return routes.stream()
                .filter(GeoFixedRoute::isActive)
                .filter(r -> r.getStart() != null && r.getEnd() != null && r.getPrice() != null)
                .sorted(EVALUATION_ORDER)
                .toList();
    }
}
