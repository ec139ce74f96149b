package com.dayloop.timeline.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * A day that starts at a fixed early-morning hour, so a session running past midnight
 * stays on the day it started.
 */
public class LogicalDay {

    private static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private final int boundaryHour;
    private final ZoneId zone;

    public LogicalDay(int boundaryHour, ZoneId zone) {
        if (boundaryHour < 0 || boundaryHour > 23) {
            throw new IllegalArgumentException("Day boundary hour must be between 0 and 23");
        }
        this.boundaryHour = boundaryHour;
        this.zone = zone;
    }

    public LocalDate dayOf(long epochSeconds) {
        ZonedDateTime time = Instant.ofEpochSecond(epochSeconds).atZone(zone);
        return time.getHour() < boundaryHour ? time.toLocalDate().minusDays(1) : time.toLocalDate();
    }

    public String labelOf(long epochSeconds) {
        return dayOf(epochSeconds).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public long startOf(LocalDate day) {
        return day.atTime(boundaryHour, 0).atZone(zone).toEpochSecond();
    }

    public long endOf(LocalDate day) {
        return startOf(day.plusDays(1));
    }

    public String clockOf(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atZone(zone).format(CLOCK_FORMAT);
    }
}
