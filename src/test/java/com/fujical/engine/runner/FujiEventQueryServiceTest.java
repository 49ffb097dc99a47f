package com.fujical.engine.runner;

import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.ScriptedProvider;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.store.InMemoryCandidateStore;
import com.fujical.engine.store.InMemoryCheckpointStore;
import com.fujical.engine.store.InMemoryFujiEventStore;
import com.fujical.engine.store.InMemoryLocationStore;
import com.fujical.engine.store.InMemoryOrbitSnapshotStore;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FujiEventQueryServiceTest {

    private static final ObserverLocation EAST = ObserverLocation.of(1L, "east", 35.3628, 139.5, 0.0);
    private static final long OTHER_LOCATION_ID = 99L;
    private static final LocalDate DAY = LocalDate.of(2025, 2, 10);
    private static final Instant SUNSET_PASS = Instant.parse("2025-02-10T08:00:00Z");

    private FujiEventQueryService service(InMemoryFujiEventStore events) {
        ScriptedProvider provider = new ScriptedProvider()
                .track(CelestialBody.SUN, SUNSET_PASS, EAST.fujiBearing, EAST.fujiElevation, 0.004, 0.003, 0.0);
        FujiOrchestrator orchestrator = new FujiOrchestrator(
                Config.defaultsOnly(),
                provider,
                new InMemoryOrbitSnapshotStore(),
                new InMemoryCandidateStore(),
                events,
                new InMemoryLocationStore(EAST),
                new InMemoryCheckpointStore(),
                () -> { }
        );
        return new FujiEventQueryService(events, orchestrator);
    }

    @Test
    void eventsForDayShouldComputeDirectlyWithoutPrecomputedYear() {
        DayEvents day = service(new InMemoryFujiEventStore()).eventsForDay(EAST, DAY);

        assertFalse(day.precomputed());
        assertEquals(1, day.events().size());
        assertEquals(PhenomenonType.DIAMOND_SUNSET, day.events().get(0).phenomenonType);
    }

    @Test
    void eventsForDayShouldServeStoredEventsOnceYearIsPrecomputed() throws Exception {
        InMemoryFujiEventStore events = new InMemoryFujiEventStore();
        Instant stored = Instant.parse("2025-02-10T08:01:00Z");
        events.insertBatch(List.of(new FujiEvent(EAST.id, DAY, stored, PhenomenonType.DIAMOND_SUNSET,
                270.0, 2.8, 0.2, 0.1, 0.8, null, null)));

        DayEvents day = service(events).eventsForDay(EAST, DAY);

        assertTrue(day.precomputed());
        assertEquals(1, day.events().size());
        assertEquals(stored, day.events().get(0).instant);
    }

    @Test
    void locationAddedAfterYearlyRunShouldBeComputedDirectly() throws Exception {
        InMemoryFujiEventStore events = new InMemoryFujiEventStore();
        events.insertBatch(List.of(new FujiEvent(OTHER_LOCATION_ID, DAY, Instant.parse("2025-02-10T08:01:00Z"),
                PhenomenonType.DIAMOND_SUNSET, 270.0, 2.8, 0.2, 0.1, 0.8, null, null)));

        DayEvents day = service(events).eventsForDay(EAST, DAY);

        assertFalse(day.precomputed());
        assertEquals(1, day.events().size());
        assertEquals(EAST.id, day.events().get(0).locationId);
    }

    @Test
    void eventsForDayShouldFallBackWhenStoreFails() {
        InMemoryFujiEventStore broken = new InMemoryFujiEventStore() {
            @Override
            public synchronized long countLocationYear(long locationId, int year) throws SQLException {
                throw new SQLException("connection refused");
            }
        };

        DayEvents day = service(broken).eventsForDay(EAST, DAY);

        assertFalse(day.precomputed());
        assertEquals(1, day.events().size());
    }
}
