package com.fujical.engine.runner;

import com.fujical.engine.model.FujiEvent;

import java.time.LocalDate;
import java.util.List;

/**
 * Events for one location and local date, with where they came from.
 */
public record DayEvents(LocalDate date, long locationId, List<FujiEvent> events, boolean precomputed) {
    public DayEvents {
        events = List.copyOf(events == null ? List.of() : events);
    }
}
