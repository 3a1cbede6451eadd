package com.transferhub.booking.model;

import java.math.BigDecimal;

/**
 * profit = (customerPrice + extrasTotal) - (driverPrice + extrasDriverTotal)
 */
public record PriceAssignment(BigDecimal profit, BigDecimal extrasTotal, BigDecimal extrasDriverTotal) {
}
