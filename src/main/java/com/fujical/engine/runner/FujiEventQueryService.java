package com.fujical.engine.runner;

import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.store.FujiEventStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;

/**
 * Serves a location's events for a day from the precomputed year when that location has
 * stored events for it, otherwise computes them directly.
 */
public final class FujiEventQueryService {
    private static final Logger LOG = LogManager.getLogger(FujiEventQueryService.class);

    private final FujiEventStore eventStore;
    private final FujiOrchestrator orchestrator;

    public FujiEventQueryService(FujiEventStore eventStore, FujiOrchestrator orchestrator) {
        this.eventStore = eventStore;
        this.orchestrator = orchestrator;
    }

    public DayEvents eventsForDay(ObserverLocation location, LocalDate date) {
        try {
            if (eventStore.countLocationYear(location.id, date.getYear()) > 0L) {
                List<FujiEvent> stored = eventStore.findByLocationAndDate(location.id, date);
                return new DayEvents(date, location.id, stored, true);
            }
            LOG.info("no precomputed events for location_id={} year={}, computing date={} directly",
                    location.id, date.getYear(), date);
        } catch (SQLException e) {
            LOG.warn("event store unavailable, computing location_id={} date={} directly: {}",
                    location.id, date, e.getMessage());
        }
        return new DayEvents(date, location.id, orchestrator.computeDayEvents(date, location), false);
    }
}
