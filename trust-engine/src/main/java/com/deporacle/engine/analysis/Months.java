package com.deporacle.engine.analysis;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Calendar-month distance used by the activity and abandonment rules.
 *
 * @author Naveed Gung
 */
final class Months {

    private Months() {
    }

    /**
     * Whole calendar months from {@code from} to {@code to} in UTC, minus half
     * a month when the day of month has not been reached yet.
     */
    static double between(Instant from, Instant to) {
        ZonedDateTime a = from.atZone(ZoneOffset.UTC);
        ZonedDateTime b = to.atZone(ZoneOffset.UTC);
        int years = b.getYear() - a.getYear();
        int months = b.getMonthValue() - a.getMonthValue();
        int days = b.getDayOfMonth() - a.getDayOfMonth();
        return years * 12 + months + (days < 0 ? -0.5 : 0);
    }
}
