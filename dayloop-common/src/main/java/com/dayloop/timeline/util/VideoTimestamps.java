package com.dayloop.timeline.util;

import java.util.Locale;

/**
 * Conversions between video-relative "MM:SS" / "HH:MM:SS" offsets and absolute unix seconds.
 * Offsets may be negative ("-05:00") when they describe context that precedes the batch.
 */
public final class VideoTimestamps {

    private VideoTimestamps() {
    }

    public static int parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Empty video timestamp");
        }
        String s = value.trim();
        boolean negative = s.startsWith("-");
        if (negative) {
            s = s.substring(1);
        }
        String[] parts = s.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid video timestamp: " + value);
        }
        int total = 0;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (!part.matches("\\d{1,4}")) {
                throw new IllegalArgumentException("Invalid video timestamp: " + value);
            }
            int n = Integer.parseInt(part);
            // leading field may overflow 60 ("75:10"), the rest may not
            if (i > 0 && n >= 60) {
                throw new IllegalArgumentException("Invalid video timestamp: " + value);
            }
            total = total * 60 + n;
        }
        return negative ? -total : total;
    }

    public static String format(long seconds) {
        if (seconds < 0) {
            return "-" + format(-seconds);
        }
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        if (h > 0) {
            return String.format(Locale.ROOT, "%02d:%02d:%02d", h, m, s);
        }
        return String.format(Locale.ROOT, "%02d:%02d", m, s);
    }

    public static long toAbsolute(String relative, long batchStartTs) {
        return batchStartTs + parse(relative);
    }

    public static String toRelative(long absoluteTs, long batchStartTs) {
        return format(absoluteTs - batchStartTs);
    }
}
