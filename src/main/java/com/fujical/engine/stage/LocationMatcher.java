package com.fujical.engine.stage;

import com.fujical.engine.config.Config;
import com.fujical.engine.geo.GeoAstronomy;
import com.fujical.engine.model.AccuracyTier;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.FujiCandidateWindow;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.model.OrbitSnapshot;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.search.QualityModel;
import com.fujical.engine.store.CandidateStore;
import com.fujical.engine.store.FujiEventStore;
import com.fujical.engine.store.LocationStore;
import com.fujical.engine.store.OrbitSnapshotStore;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Stage 3: matches every registered location against the precomputed positions and
 * writes the deduplicated events.
 */
public final class LocationMatcher {
    private static final double QUALITY_EPSILON = 1e-9;

    private final OrbitSnapshotStore snapshotStore;
    private final CandidateStore candidateStore;
    private final FujiEventStore eventStore;
    private final LocationStore locationStore;
    private final QualityModel qualityModel;
    private final ZoneId zone;
    private final MatchSource source;
    private final int threads;
    private final int logEvery;
    private final int batchSize;
    private final double maxDistanceKm;
    private final double summitWidthMeters;
    private final double diamondElevationBand;
    private final double pearlAzimuthTolerance;
    private final double pearlElevationTolerance;
    private final double moonMinIllumination;
    private final double maxTotalDiff;
    private final double qualityMargin;
    private final long minSeparationMinutes;
    private final int maxEventsPerDay;

    public LocationMatcher(
            Config config,
            OrbitSnapshotStore snapshotStore,
            CandidateStore candidateStore,
            FujiEventStore eventStore,
            LocationStore locationStore
    ) {
        this.snapshotStore = snapshotStore;
        this.candidateStore = candidateStore;
        this.eventStore = eventStore;
        this.locationStore = locationStore;
        this.qualityModel = new QualityModel(config);
        this.zone = config.zone();
        this.source = MatchSource.parse(config.getString("stage3.source", "STAGE1"));
        this.threads = Math.max(1, config.getInt("stage3.threads", 4));
        this.logEvery = Math.max(0, config.getInt("stage3.progress.log_every", 20));
        this.batchSize = Math.max(1, config.getInt("stage3.batch_size", 1000));
        this.maxDistanceKm = config.getDouble("stage3.max_distance_km", 300.0);
        this.summitWidthMeters = config.getDouble("fuji.summit_width_m", 800.0);
        this.diamondElevationBand = config.getDouble("stage3.diamond.elevation_band", 2.0);
        this.pearlAzimuthTolerance = config.getDouble("stage3.pearl.azimuth_tolerance", 2.0);
        this.pearlElevationTolerance = config.getDouble("stage3.pearl.elevation_tolerance", 2.0);
        this.moonMinIllumination = config.getDouble("stage3.moon.min_illumination", 0.70);
        this.maxTotalDiff = config.getDouble("stage3.max_total_diff", 2.5);
        this.qualityMargin = config.getDouble("stage3.dedup.quality_margin", 0.1);
        this.minSeparationMinutes = Math.max(0, config.getInt("stage3.dedup.min_separation_minutes", 120));
        this.maxEventsPerDay = Math.max(1, config.getInt("stage3.dedup.max_events_per_day", 2));
    }

    public MatchSource source() {
        return source;
    }

    public Summary matchAll(int year) throws SQLException, InterruptedException {
        return matchAll(year, () -> false);
    }

    /**
     * Replaces the year's events for every location. A location that fails is logged and skipped.
     */
    public Summary matchAll(int year, BooleanSupplier cancelled) throws SQLException, InterruptedException {
        long started = System.currentTimeMillis();
        eventStore.deleteYear(year);
        List<ObserverLocation> locations = locationStore.findAll();
        int total = locations.size();
        if (total == 0) {
            System.out.println("Stage3 no locations registered, year=" + year);
            return new Summary(year, 0, 0, 0L, 0, false);
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CompletionService<LocationEvents> completion = new ExecutorCompletionService<>(pool);
        int submitted = 0;
        boolean wasCancelled = false;
        for (ObserverLocation location : locations) {
            if (cancelled.getAsBoolean()) {
                wasCancelled = true;
                break;
            }
            completion.submit(() -> matchTask(year, location));
            submitted++;
        }

        int withEvents = 0;
        int failed = 0;
        long written = 0L;
        try {
            for (int i = 0; i < submitted; i++) {
                Future<LocationEvents> future = completion.take();
                LocationEvents result = null;
                try {
                    result = future.get();
                    if (!result.events.isEmpty()) {
                        written += insert(result.events);
                        withEvents++;
                    }
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    System.err.println("Stage[stage3] failed err=" + cause.getMessage());
                } catch (SQLException e) {
                    failed++;
                    System.err.println("Stage[stage3] insert failed location_id=" + result.location.id + ", err=" + e.getMessage());
                }
                int completed = i + 1;
                if (completed >= submitted || (logEvery > 0 && completed % logEvery == 0)) {
                    System.out.println(String.format(
                            Locale.US,
                            "Stage3 progress year=%d locations=%d/%d events=%d failed=%d",
                            year,
                            completed,
                            total,
                            written,
                            failed
                    ));
                }
            }
        } finally {
            pool.shutdown();
        }
        System.out.println(String.format(
                Locale.US,
                "Stage3 done year=%d source=%s locations=%d with_events=%d events=%d failed=%d cancelled=%s elapsed_ms=%d",
                year,
                source,
                total,
                withEvents,
                written,
                failed,
                wasCancelled,
                System.currentTimeMillis() - started
        ));
        return new Summary(year, total, withEvents, written, failed, wasCancelled);
    }

    /**
     * Replaces one location's events for the year. Returns the number written.
     */
    public int rematchLocation(int year, ObserverLocation location) throws SQLException {
        eventStore.deleteLocationYear(location.id, year);
        List<FujiEvent> events = matchLocation(year, location);
        return insert(events);
    }

    /**
     * Events for one location, deduplicated, ordered by instant. Nothing is written.
     */
    public List<FujiEvent> matchLocation(int year, ObserverLocation location) throws SQLException {
        double distanceKm = location.fujiDistanceKm();
        if (distanceKm > maxDistanceKm) {
            return List.of();
        }
        List<FujiEvent> raw = new ArrayList<>();
        for (CelestialBody body : CelestialBody.values()) {
            double azimuthTolerance = body == CelestialBody.SUN
                    ? diamondAzimuthTolerance(location.fujiDistance)
                    : pearlAzimuthTolerance;
            double elevationTolerance = body == CelestialBody.SUN ? diamondElevationBand : pearlElevationTolerance;
            double elevationMin = location.fujiElevation - elevationTolerance;
            double elevationMax = location.fujiElevation + elevationTolerance;
            for (AzimuthRange range : AzimuthRange.around(location.fujiBearing, azimuthTolerance)) {
                if (source == MatchSource.STAGE1) {
                    Double minIllumination = body == CelestialBody.MOON ? moonMinIllumination : null;
                    for (OrbitSnapshot s : snapshotStore.findInBand(
                            year, body, range.min(), range.max(), elevationMin, elevationMax, minIllumination)) {
                        if (body == CelestialBody.MOON
                                && (s.moonIllumination == null || s.moonIllumination < moonMinIllumination)) {
                            continue;
                        }
                        ZonedDateTime local = s.instant.atZone(zone);
                        FujiEvent event = toEvent(
                                location,
                                local.toLocalDate(),
                                s.instant,
                                PhenomenonType.ofAzimuth(body, s.azimuth),
                                s.azimuth,
                                s.elevation,
                                qualityModel.atmosphericFactor(local),
                                s.moonPhase,
                                s.moonIllumination,
                                azimuthTolerance,
                                elevationTolerance
                        );
                        if (event != null) {
                            raw.add(event);
                        }
                    }
                } else {
                    for (FujiCandidateWindow c : candidateStore.findInBand(
                            year, body, range.min(), range.max(), elevationMin, elevationMax)) {
                        FujiEvent event = toEvent(
                                location,
                                c.date,
                                c.instant,
                                c.phenomenonType,
                                c.azimuth,
                                c.elevation,
                                c.atmosphericFactor,
                                c.moonPhase,
                                c.moonIllumination,
                                azimuthTolerance,
                                elevationTolerance
                        );
                        if (event != null) {
                            raw.add(event);
                        }
                    }
                }
            }
        }
        return deduplicate(raw);
    }

    /**
     * Per (date, phenomenon): keeps the best event and any other within the quality margin
     * that is far enough in time from every kept event, up to the daily cap.
     */
    public List<FujiEvent> deduplicate(List<FujiEvent> events) {
        Map<String, List<FujiEvent>> groups = new LinkedHashMap<>();
        for (FujiEvent event : events) {
            String key = event.date + "|" + event.phenomenonType.code();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
        }

        Comparator<FujiEvent> ranking = Comparator
                .comparingDouble((FujiEvent e) -> e.qualityScore).reversed()
                .thenComparingDouble(e -> e.totalDiff)
                .thenComparing(e -> e.instant);
        List<FujiEvent> out = new ArrayList<>();
        for (List<FujiEvent> group : groups.values()) {
            group.sort(ranking);
            FujiEvent best = group.get(0);
            List<FujiEvent> kept = new ArrayList<>();
            kept.add(best);
            for (int i = 1; i < group.size() && kept.size() < maxEventsPerDay; i++) {
                FujiEvent candidate = group.get(i);
                if (best.qualityScore - candidate.qualityScore > qualityMargin + QUALITY_EPSILON) {
                    break;
                }
                if (farFromAll(candidate.instant, kept)) {
                    kept.add(candidate);
                }
            }
            out.addAll(kept);
        }
        out.sort(Comparator.comparing((FujiEvent e) -> e.instant).thenComparing(e -> e.phenomenonType));
        return out;
    }

    /**
     * Full apparent width of the summit, 2·atan(w / 2d), plus the sun's radius.
     */
    double diamondAzimuthTolerance(double distanceMeters) {
        double summitWidth = Math.toDegrees(2.0 * Math.atan(summitWidthMeters / (2.0 * Math.max(1.0, distanceMeters))));
        return summitWidth + CelestialBody.SUN.angularRadiusDeg();
    }

    private FujiEvent toEvent(
            ObserverLocation location,
            LocalDate date,
            Instant instant,
            PhenomenonType type,
            double azimuth,
            double elevation,
            double atmosphericFactor,
            Double moonPhase,
            Double moonIllumination,
            double azimuthTolerance,
            double elevationTolerance
    ) {
        double azimuthDiff = GeoAstronomy.azimuthDifference(azimuth, location.fujiBearing);
        double elevationDiff = Math.abs(elevation - location.fujiElevation);
        if (azimuthDiff > azimuthTolerance || elevationDiff > elevationTolerance) {
            return null;
        }
        if (AccuracyTier.totalDiff(azimuthDiff, elevationDiff) > maxTotalDiff) {
            return null;
        }
        double quality = qualityModel.score(azimuthDiff, elevationDiff, atmosphericFactor, location.fujiDistanceKm());
        return new FujiEvent(
                location.id,
                date,
                instant,
                type,
                azimuth,
                elevation,
                azimuthDiff,
                elevationDiff,
                quality,
                moonPhase,
                moonIllumination
        );
    }

    private LocationEvents matchTask(int year, ObserverLocation location) throws SQLException {
        try {
            return new LocationEvents(location, matchLocation(year, location));
        } catch (SQLException | RuntimeException e) {
            throw new SQLException("location_id=" + location.id + ", " + e.getMessage(), e);
        }
    }

    private boolean farFromAll(Instant instant, List<FujiEvent> kept) {
        for (FujiEvent e : kept) {
            long minutes = Math.abs(Duration.between(e.instant, instant).toMinutes());
            if (minutes < minSeparationMinutes) {
                return false;
            }
        }
        return true;
    }

    private int insert(List<FujiEvent> events) throws SQLException {
        int written = 0;
        for (int from = 0; from < events.size(); from += batchSize) {
            int to = Math.min(events.size(), from + batchSize);
            written += eventStore.insertBatch(events.subList(from, to));
        }
        return written;
    }

    public record Summary(
            int year,
            int locations,
            int locationsWithEvents,
            long eventsWritten,
            int failedLocations,
            boolean cancelled
    ) {
    }

    private static final class LocationEvents {
        final ObserverLocation location;
        final List<FujiEvent> events;

        private LocationEvents(ObserverLocation location, List<FujiEvent> events) {
            this.location = location;
            this.events = events;
        }
    }
}
