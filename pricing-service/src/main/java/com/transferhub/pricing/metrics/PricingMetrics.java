package com.transferhub.pricing.metrics;

import com.transferhub.pricing.model.PricingTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Custom Micrometer metrics for the pricing service.
 *
 * Metrics at /actuator/prometheus:
 *   pricing_quote_tier_total{tier}      number of vehicle-class prices produced per tier
 *   pricing_unconfigured_total          classes that fell through to the default formula
 *   pricing_quote_latency_seconds       end-to-end latency of a quote request
 */
@Component
public class PricingMetrics {

    private final Map<PricingTier, Counter> tierCounters = new EnumMap<>(PricingTier.class);
    private final Counter unconfiguredCounter;
    private final Timer quoteLatencyTimer;

    public PricingMetrics(MeterRegistry registry) {
        for (PricingTier tier : PricingTier.values()) {
            tierCounters.put(tier, Counter.builder("pricing.quote.tier")
                    .description("Vehicle-class prices produced, by winning tier")
                    .tag("tier", tier.name())
                    .register(registry));
        }

        this.unconfiguredCounter = Counter.builder("pricing.unconfigured")
                .description("Vehicle classes with no configured pricing, priced by the default formula")
                .register(registry);

        this.quoteLatencyTimer = Timer.builder("pricing.quote.latency")
                .description("Time to build a full quote response")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordTier(PricingTier tier)      { tierCounters.get(tier).increment(); }
    public void recordUnconfigured()              { unconfiguredCounter.increment(); }
    public void recordQuoteLatency(long nanos)    { quoteLatencyTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
