package com.transferhub.booking.metrics;

import com.transferhub.shared.enums.InvoiceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Custom Micrometer metrics for the Booking Service.
 *
 * Metrics at /actuator/prometheus:
 *   billing_invoices_generated_total{type}
 *   billing_booking_repriced_total            price, extras or driver assignment changed
 *   billing_concurrent_modification_total     optimistic-lock conflicts returned as 409
 */
@Component
public class BillingMetrics {

    private final Map<InvoiceType, Counter> invoicesGenerated = new EnumMap<>(InvoiceType.class);
    private final Counter bookingRepricedCounter;
    private final Counter concurrentModificationCounter;

    public BillingMetrics(MeterRegistry registry) {
        for (InvoiceType type : InvoiceType.values()) {
            invoicesGenerated.put(type, Counter.builder("billing.invoices.generated")
                    .tag("type", type.name())
                    .description("Invoices generated, by type")
                    .register(registry));
        }

        this.bookingRepricedCounter = Counter.builder("billing.booking.repriced")
                .description("Booking price recalculations (price edit, extras edit, reassignment)")
                .register(registry);

        this.concurrentModificationCounter = Counter.builder("billing.concurrent_modification")
                .description("Booking or invoice updates rejected by optimistic locking")
                .register(registry);
    }

    public void recordInvoiceGenerated(InvoiceType type) { invoicesGenerated.get(type).increment(); }
    public void recordBookingRepriced()                 { bookingRepricedCounter.increment(); }
    public void recordConcurrentModification()          { concurrentModificationCounter.increment(); }
}
