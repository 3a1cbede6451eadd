package com.transferhub.booking.service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Days until an invoice falls due for a free-text payment-terms value.
 *
 *   "Net N"                    -> N
 *   "weekly"                   -> 7
 *   "fortnightly", "biweekly"  -> 14
 *   "monthly"                  -> 30
 *   anything else              -> 14
 */
public final class PaymentTerms {

    public static final int DEFAULT_DAYS = 14;
    public static final String DEFAULT_TERMS = "Net " + DEFAULT_DAYS;

    private static final Pattern NET_DAYS = Pattern.compile("^net\\s*(\\d{1,3})$");

    private PaymentTerms() {}

    public static int dueInDays(String terms) {
        if (terms == null || terms.isBlank()) {
            return DEFAULT_DAYS;
        }
        String normalised = terms.trim().toLowerCase(Locale.ROOT);
        Matcher net = NET_DAYS.matcher(normalised);
        if (net.matches()) {
            return Integer.parseInt(net.group(1));
        }
        return switch (normalised) {
            case "weekly" -> 7;
            case "fortnightly", "biweekly", "bi-weekly" -> 14;
            case "monthly" -> 30;
            default -> DEFAULT_DAYS;
        };
    }
}
