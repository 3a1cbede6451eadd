package com.transferhub.shared.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary helpers. Every amount leaving a calculator is scale 2, HALF_UP.
 */
public final class MoneyUtil {

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtil() {}

    public static BigDecimal round(BigDecimal amount) {
        return nullToZero(amount).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal nullToZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    /**
     * {@code amount * percent / 100}, unrounded.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return nullToZero(amount).multiply(nullToZero(percent)).divide(HUNDRED);
    }
}
