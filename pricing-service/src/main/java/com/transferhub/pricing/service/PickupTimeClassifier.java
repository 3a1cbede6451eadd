package com.transferhub.pricing.service;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * Night window is 22:00 to 05:59 local pickup time; weekend is Saturday and Sunday.
 */
@Component
public class PickupTimeClassifier {

    static final int NIGHT_START_HOUR = 22;
    static final int NIGHT_END_HOUR   = 6;

    public boolean isNight(LocalDateTime pickup) {
        if (pickup == null) {
            return false;
        }
        int hour = pickup.getHour();
        return hour >= NIGHT_START_HOUR || hour < NIGHT_END_HOUR;
    }

    public boolean isWeekend(LocalDateTime pickup) {
        if (pickup == null) {
            return false;
        }
        DayOfWeek day = pickup.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
