package com.transferhub.booking.service;

import com.transferhub.booking.entity.BookingExtra;
import com.transferhub.booking.model.PriceAssignment;
import com.transferhub.shared.util.MoneyUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Dual pricing: the customer pays customerPrice plus all extras, the driver is owed
 * driverPrice plus the extras that affect driver cost.
 *
 *   extrasTotal       = sum(extra.price)
 *   extrasDriverTotal = sum(extra.price where affectsDriverCost)
 *   profit            = (customerPrice + extrasTotal) - (driverPrice + extrasDriverTotal)
 *
 * Null prices count as zero.
 */
@Component
public class DualPriceAssigner {

    public PriceAssignment assign(BigDecimal customerPrice, BigDecimal driverPrice, List<BookingExtra> extras) {
        List<BookingExtra> items = extras != null ? extras : List.of();

        BigDecimal extrasTotal = BigDecimal.ZERO;
        BigDecimal extrasDriverTotal = BigDecimal.ZERO;
        for (BookingExtra extra : items) {
            BigDecimal price = MoneyUtil.nullToZero(extra.getPrice());
            extrasTotal = extrasTotal.add(price);
            if (extra.isAffectsDriverCost()) {
                extrasDriverTotal = extrasDriverTotal.add(price);
            }
        }

        BigDecimal revenue = MoneyUtil.nullToZero(customerPrice).add(extrasTotal);
        BigDecimal cost = MoneyUtil.nullToZero(driverPrice).add(extrasDriverTotal);

        return new PriceAssignment(
                MoneyUtil.round(revenue.subtract(cost)),
                MoneyUtil.round(extrasTotal),
                MoneyUtil.round(extrasDriverTotal));
    }
}
