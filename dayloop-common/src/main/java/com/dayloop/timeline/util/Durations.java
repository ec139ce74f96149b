package com.dayloop.timeline.util;

import java.time.Duration;

public final class Durations {

    private Durations() {
    }

    /** "3m 12s", or "12s" under a minute. */
    public static String humanize(Duration duration) {
        long total = Math.max(0, duration.getSeconds());
        long minutes = total / 60;
        long seconds = total % 60;
        return minutes > 0 ? minutes + "m " + seconds + "s" : seconds + "s";
    }
}
