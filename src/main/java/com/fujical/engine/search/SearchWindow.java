package com.fujical.engine.search;

import java.time.Instant;

/**
 * Half-open interval [start, end).
 */
public record SearchWindow(Instant start, Instant end) {
    public SearchWindow {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new IllegalArgumentException("invalid search window " + start + " - " + end);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && instant.isBefore(end);
    }

    public Instant clamp(Instant instant) {
        if (instant.isBefore(start)) {
            return start;
        }
        return instant.isAfter(end) ? end : instant;
    }
}
