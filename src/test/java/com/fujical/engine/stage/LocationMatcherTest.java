package com.fujical.engine.stage;

import com.fujical.engine.config.Config;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.DayPart;
import com.fujical.engine.model.FujiCandidateWindow;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.model.OrbitSnapshot;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.store.InMemoryCandidateStore;
import com.fujical.engine.store.InMemoryFujiEventStore;
import com.fujical.engine.store.InMemoryLocationStore;
import com.fujical.engine.store.InMemoryOrbitSnapshotStore;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationMatcherTest {

    private static final int YEAR = 2025;
    private static final LocalDate DAY = LocalDate.of(2025, 2, 10);
    private static final ObserverLocation EAST = ObserverLocation.of(1L, "east", 35.3628, 139.5, 0.0);
    private static final ObserverLocation FAR = ObserverLocation.of(2L, "far", 35.3628, 142.8, 0.0);

    private final InMemoryOrbitSnapshotStore snapshots = new InMemoryOrbitSnapshotStore();
    private final InMemoryCandidateStore candidates = new InMemoryCandidateStore();
    private final InMemoryFujiEventStore events = new InMemoryFujiEventStore();
    private final InMemoryLocationStore locations = new InMemoryLocationStore(EAST, FAR);

    private LocationMatcher matcher(Config config) {
        return new LocationMatcher(config, snapshots, candidates, events, locations);
    }

    private void seedSnapshots() throws SQLException {
        snapshots.insertBatch(List.of(
                new OrbitSnapshot(YEAR, Instant.parse("2025-02-10T08:00:00Z"), CelestialBody.SUN,
                        EAST.fujiBearing + 0.1, EAST.fujiElevation + 0.1, true, null, null),
                new OrbitSnapshot(YEAR, Instant.parse("2025-02-10T08:05:00Z"), CelestialBody.SUN,
                        EAST.fujiBearing + 5.0, EAST.fujiElevation - 0.3, true, null, null),
                new OrbitSnapshot(YEAR, Instant.parse("2025-02-09T18:00:00Z"), CelestialBody.MOON,
                        EAST.fujiBearing + 0.5, EAST.fujiElevation - 0.5, true, 0.5, 0.9),
                new OrbitSnapshot(YEAR, Instant.parse("2025-03-09T18:00:00Z"), CelestialBody.MOON,
                        EAST.fujiBearing, EAST.fujiElevation, true, 0.1, 0.3)
        ));
    }

    private static FujiEvent event(String instant, double quality) {
        return new FujiEvent(EAST.id, DAY, Instant.parse(instant), PhenomenonType.DIAMOND_SUNSET,
                270.0, 2.8, 0.1, 0.1, quality, null, null);
    }

    @Test
    void matchLocationShouldTurnAlignedSnapshotsIntoEvents() throws Exception {
        seedSnapshots();

        List<FujiEvent> out = matcher(Config.defaultsOnly()).matchLocation(YEAR, EAST);

        assertEquals(2, out.size());
        FujiEvent pearl = out.get(0);
        assertEquals(PhenomenonType.PEARL_MOONSET, pearl.phenomenonType);
        assertEquals(0.9, pearl.moonIllumination, 1e-9);
        FujiEvent diamond = out.get(1);
        assertEquals(PhenomenonType.DIAMOND_SUNSET, diamond.phenomenonType);
        assertEquals(DAY, diamond.date);
        assertEquals(0.1, diamond.azimuthDiff, 1e-9);
        assertEquals(0.1, diamond.elevationDiff, 1e-9);
        assertEquals(0.95, diamond.qualityScore, 1e-9);
        assertTrue(out.stream().allMatch(e -> e.totalDiff <= 2.5));
    }

    @Test
    void locationBeyondMaximumDistanceShouldHaveNoEvents() throws Exception {
        seedSnapshots();

        assertTrue(FAR.fujiDistanceKm() > 300.0);
        assertTrue(matcher(Config.defaultsOnly()).matchLocation(YEAR, FAR).isEmpty());
    }

    @Test
    void matchAllShouldReplaceTheYearAndCountLocations() throws Exception {
        seedSnapshots();
        LocationMatcher matcher = matcher(Config.defaultsOnly());

        LocationMatcher.Summary first = matcher.matchAll(YEAR);
        LocationMatcher.Summary second = matcher.matchAll(YEAR);

        assertEquals(2, first.locations());
        assertEquals(1, first.locationsWithEvents());
        assertEquals(2L, first.eventsWritten());
        assertEquals(0, first.failedLocations());
        assertEquals(2L, second.eventsWritten());
        assertEquals(2L, events.countYear(YEAR));
        assertEquals(1, events.countLocationsWithEvents(YEAR));
    }

    @Test
    void matchAllWithoutLocationsShouldWriteNothing() throws Exception {
        seedSnapshots();
        LocationMatcher matcher = new LocationMatcher(
                Config.defaultsOnly(), snapshots, candidates, events, new InMemoryLocationStore());

        LocationMatcher.Summary summary = matcher.matchAll(YEAR);

        assertEquals(0, summary.locations());
        assertEquals(0L, summary.eventsWritten());
    }

    @Test
    void failingLocationShouldBeCountedAndSkipped() throws Exception {
        InMemoryOrbitSnapshotStore broken = new InMemoryOrbitSnapshotStore() {
            @Override
            public synchronized List<OrbitSnapshot> findInBand(
                    int year, CelestialBody body, double azimuthMin, double azimuthMax,
                    double elevationMin, double elevationMax, Double minIllumination) {
                throw new IllegalStateException("connection reset");
            }
        };
        LocationMatcher matcher = new LocationMatcher(
                Config.defaultsOnly(), broken, candidates, events, new InMemoryLocationStore(EAST));

        LocationMatcher.Summary summary = matcher.matchAll(YEAR);

        assertEquals(1, summary.failedLocations());
        assertEquals(0L, summary.eventsWritten());
    }

    @Test
    void rematchLocationShouldReplaceOnlyThatLocation() throws Exception {
        seedSnapshots();
        LocationMatcher matcher = matcher(Config.defaultsOnly());
        matcher.matchAll(YEAR);

        int written = matcher.rematchLocation(YEAR, EAST);

        assertEquals(2, written);
        assertEquals(2L, events.countYear(YEAR));
    }

    @Test
    void candidateSourceShouldMatchAgainstStageTwoWindows() throws Exception {
        candidates.insertBatch(List.of(new FujiCandidateWindow(
                YEAR, DAY, Instant.parse("2025-02-10T08:00:00Z"), CelestialBody.SUN,
                PhenomenonType.DIAMOND_SUNSET, DayPart.AFTERNOON,
                EAST.fujiBearing + 0.1, EAST.fujiElevation + 0.1, null, null, 0.8)));
        LocationMatcher matcher = matcher(Config.of(Map.of("stage3.source", "stage2")));

        List<FujiEvent> out = matcher.matchLocation(YEAR, EAST);

        assertEquals(MatchSource.STAGE2, matcher.source());
        assertEquals(1, out.size());
        assertEquals(0.95 * 0.8, out.get(0).qualityScore, 1e-9);
    }

    @Test
    void stageTwoSourceWithoutCandidatesShouldWriteNoEvents() throws Exception {
        seedSnapshots();
        LocationMatcher matcher = matcher(Config.of(Map.of("stage3.source", "stage2")));

        LocationMatcher.Summary summary = matcher.matchAll(YEAR);

        assertEquals(0L, summary.eventsWritten());
        assertEquals(0L, events.countYear(YEAR));
    }

    @Test
    void deduplicateShouldKeepWellSeparatedEventsOfSimilarQuality() {
        List<FujiEvent> out = matcher(Config.defaultsOnly()).deduplicate(List.of(
                event("2025-02-10T11:00:00Z", 0.88),
                event("2025-02-10T08:00:00Z", 0.91)
        ));

        assertEquals(2, out.size());
        assertEquals(Instant.parse("2025-02-10T08:00:00Z"), out.get(0).instant);
        assertEquals(Instant.parse("2025-02-10T11:00:00Z"), out.get(1).instant);
    }

    @Test
    void deduplicateShouldDropMuchWorseNeighbour() {
        List<FujiEvent> out = matcher(Config.defaultsOnly()).deduplicate(List.of(
                event("2025-02-10T08:00:00Z", 0.91),
                event("2025-02-10T08:20:00Z", 0.70)
        ));

        assertEquals(1, out.size());
        assertEquals(0.91, out.get(0).qualityScore, 1e-9);
    }

    @Test
    void deduplicateShouldKeepNeighbourExactlyAtTheQualityMargin() {
        List<FujiEvent> out = matcher(Config.defaultsOnly()).deduplicate(List.of(
                event("2025-02-10T08:00:00Z", 0.91),
                event("2025-02-10T11:00:00Z", 0.81)
        ));

        assertEquals(2, out.size());
        assertEquals(0.81, out.get(1).qualityScore, 1e-9);
    }

    @Test
    void deduplicateShouldDropCloseNeighbourOfSimilarQuality() {
        List<FujiEvent> out = matcher(Config.defaultsOnly()).deduplicate(List.of(
                event("2025-02-10T08:20:00Z", 0.88),
                event("2025-02-10T08:00:00Z", 0.91)
        ));

        assertEquals(1, out.size());
        assertEquals(Instant.parse("2025-02-10T08:00:00Z"), out.get(0).instant);
    }

    @Test
    void deduplicateShouldRespectDailyCap() {
        List<FujiEvent> out = matcher(Config.defaultsOnly()).deduplicate(List.of(
                event("2025-02-10T08:00:00Z", 0.91),
                event("2025-02-10T11:00:00Z", 0.90),
                event("2025-02-10T14:00:00Z", 0.89)
        ));

        assertEquals(2, out.size());
        assertEquals(Instant.parse("2025-02-10T11:00:00Z"), out.get(1).instant);
    }

    @Test
    void deduplicateOfNothingShouldBeEmpty() {
        assertTrue(matcher(Config.defaultsOnly()).deduplicate(List.of()).isEmpty());
    }

    @Test
    void diamondToleranceShouldNarrowWithDistance() {
        LocationMatcher matcher = matcher(Config.defaultsOnly());

        double near = matcher.diamondAzimuthTolerance(30_000.0);
        double far = matcher.diamondAzimuthTolerance(150_000.0);

        assertTrue(near > far);
        assertTrue(far > CelestialBody.SUN.angularRadiusDeg());
    }

    @Test
    void diamondToleranceShouldUseTheFullSummitWidth() {
        double distance = 100_000.0;
        double fullWidth = Math.toDegrees(2.0 * Math.atan(800.0 / (2.0 * distance)));

        double tolerance = matcher(Config.defaultsOnly()).diamondAzimuthTolerance(distance);

        assertEquals(fullWidth + CelestialBody.SUN.angularRadiusDeg(), tolerance, 1e-9);
    }
}
