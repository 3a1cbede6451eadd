package com.transferhub.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.transferhub.shared.enums.BookingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published on booking.created, booking.price.changed, booking.reassigned and
 * booking.completed. Carries the full price triple so consumers never have to
 * recompute profit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingEvent {

    private String bookingId;
    private String bookingRef;
    private BookingStatus status;
    private String fleetId;
    private String driverId;
    private String previousDriverId;
    private BigDecimal customerPrice;
    private BigDecimal driverPrice;
    private BigDecimal extrasTotal;
    private BigDecimal profit;
    private String currency;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;
}
