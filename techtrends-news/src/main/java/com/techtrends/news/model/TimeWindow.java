package com.techtrends.news.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Half-open publish-time window {@code [from, to)}.
 */
public record TimeWindow(Instant from, Instant to) {

    private static final TimeWindow ALL = new TimeWindow(Instant.EPOCH, Instant.MAX);

    public TimeWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Window bounds must not be null");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end " + to + " is before start " + from);
        }
    }

    public static TimeWindow all() {
        return ALL;
    }

    /**
     * The last {@code length} up to now, end exclusive (a millisecond past now).
     */
    public static TimeWindow last(Duration length, Clock clock) {
        Instant now = clock.instant();
        return new TimeWindow(now.minus(length), now.plusMillis(1));
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && instant.isBefore(to);
    }
}
