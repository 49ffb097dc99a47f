package com.fujical.engine.runner;

import com.fujical.core.CheckResult;
import com.fujical.core.RunTelemetry;
import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.CelestialPositionProvider;
import com.fujical.engine.geo.InvalidCoordinatesException;
import com.fujical.engine.model.EventStatistics;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.search.AlignmentSearch;
import com.fujical.engine.stage.CandidateFilter;
import com.fujical.engine.stage.LocationMatcher;
import com.fujical.engine.stage.MatchSource;
import com.fujical.engine.stage.OrbitSnapshotGenerator;
import com.fujical.engine.store.CandidateStore;
import com.fujical.engine.store.CheckpointStore;
import com.fujical.engine.store.FujiEventStore;
import com.fujical.engine.store.LocationStore;
import com.fujical.engine.store.OrbitSnapshotStore;
import com.fujical.engine.store.StoreHealth;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the three stages for a year in order, recomputes single locations, answers
 * direct day queries and reports pipeline health.
 */
public final class FujiOrchestrator {
    public static final String HEALTHY_RECOMMENDATION = "All stages healthy";

    private final Config config;
    private final OrbitSnapshotStore snapshotStore;
    private final CandidateStore candidateStore;
    private final FujiEventStore eventStore;
    private final LocationStore locationStore;
    private final StoreHealth storeHealth;
    private final OrbitSnapshotGenerator stage1;
    private final CandidateFilter stage2;
    private final LocationMatcher stage3;
    private final AlignmentSearch alignmentSearch;

    private final Map<Integer, ReentrantLock> yearLocks = new ConcurrentHashMap<>();
    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile RunTelemetry lastTelemetry;

    public FujiOrchestrator(
            Config config,
            CelestialPositionProvider provider,
            OrbitSnapshotStore snapshotStore,
            CandidateStore candidateStore,
            FujiEventStore eventStore,
            LocationStore locationStore,
            CheckpointStore checkpointStore,
            StoreHealth storeHealth
    ) {
        this.config = config;
        this.snapshotStore = snapshotStore;
        this.candidateStore = candidateStore;
        this.eventStore = eventStore;
        this.locationStore = locationStore;
        this.storeHealth = storeHealth;
        this.stage1 = new OrbitSnapshotGenerator(config, provider, snapshotStore, checkpointStore);
        this.stage2 = new CandidateFilter(config, snapshotStore, candidateStore);
        this.stage3 = new LocationMatcher(config, snapshotStore, candidateStore, eventStore, locationStore);
        this.alignmentSearch = new AlignmentSearch(provider, config);
    }

    public OrchestratorState state() {
        return state.get();
    }

    public Optional<RunTelemetry> lastTelemetry() {
        return Optional.ofNullable(lastTelemetry);
    }

    /**
     * Requests the running stage to stop at its next chunk or location boundary.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    /**
     * Drops the Stage-1 resume point so the next run starts the year over.
     */
    public void resetCheckpoint() throws SQLException {
        stage1.resetCheckpoint();
    }

    public PrecomputeResult precomputeYear(int year) {
        return precomputeYear(year, false);
    }

    public PrecomputeResult precomputeYear(int year, boolean resetCheckpoint) {
        return execute(year, true, resetCheckpoint, "PRECOMPUTE");
    }

    /**
     * Re-runs Stages 2 and 3 against the year's existing Stage-1 snapshots.
     */
    public PrecomputeResult executeFromStage2(int year) {
        return execute(year, false, false, "FROM_STAGE2");
    }

    public RecomputeResult recomputeLocation(long locationId, int year) {
        long started = System.currentTimeMillis();
        ReentrantLock lock = yearLocks.computeIfAbsent(year, y -> new ReentrantLock());
        if (!lock.tryLock()) {
            return RecomputeResult.failed(locationId, year, 0L, "run already in progress for year " + year);
        }
        try {
            Optional<ObserverLocation> location = locationStore.findById(locationId);
            if (location.isEmpty()) {
                return RecomputeResult.failed(locationId, year, elapsed(started), "location not found: " + locationId);
            }
            long available = stage3.source() == MatchSource.STAGE1
                    ? snapshotStore.countYear(year)
                    : candidateStore.countYear(year);
            if (available <= 0L) {
                return RecomputeResult.failed(locationId, year, elapsed(started),
                        "no precomputed " + stage3.source() + " data for year " + year + ", run precomputeYear first");
            }
            state.set(OrchestratorState.STAGE3_RUNNING);
            int count = stage3.rematchLocation(year, location.get());
            state.set(OrchestratorState.DONE);
            System.out.println(String.format(
                    Locale.US,
                    "Recompute location_id=%d year=%d events=%d elapsed_ms=%d",
                    locationId,
                    year,
                    count,
                    elapsed(started)
            ));
            return new RecomputeResult(true, locationId, year, count, elapsed(started), null);
        } catch (SQLException | InvalidCoordinatesException e) {
            state.set(OrchestratorState.FAILED);
            System.err.println("Stage[recompute] failed location_id=" + locationId + ", err=" + e.getMessage());
            return RecomputeResult.failed(locationId, year, elapsed(started), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Direct path: searches the day without any precomputed data.
     */
    public List<FujiEvent> computeDayEvents(LocalDate date, ObserverLocation location) {
        return alignmentSearch.computeDayEvents(date, location);
    }

    public HealthReport healthCheck(int year) {
        Map<String, CheckResult> checks = new LinkedHashMap<>();
        List<String> recommendations = new ArrayList<>();

        try {
            storeHealth.ping();
            checks.put("database", CheckResult.ok("reachable", Map.of()));
        } catch (SQLException e) {
            checks.put("database", CheckResult.fail("unreachable", Map.of("error", safe(e.getMessage()))));
            recommendations.add("Check database connectivity and credentials (db.url, db.user, db.pass).");
        }

        try {
            long actual = snapshotStore.countYear(year);
            long expected = stage1.expectedSnapshots(year);
            double ratio = expected <= 0L ? 0.0 : actual / (double) expected;
            double okRatio = config.getDouble("health.stage1_ok_ratio", 0.95);
            Map<String, Object> evidence = Map.of("actual", actual, "expected", expected, "ratio", ratio);
            if (ratio >= okRatio) {
                checks.put("stage1", CheckResult.ok("snapshots complete", evidence));
            } else if (actual > 0L) {
                checks.put("stage1", CheckResult.warn("snapshots incomplete", evidence));
                recommendations.add(String.format(Locale.US,
                        "Stage 1 holds %d of %d expected snapshots for %d; rerun precompute to resume from the last chunk.",
                        actual, expected, year));
            } else {
                checks.put("stage1", CheckResult.fail("no snapshots", evidence));
                recommendations.add("Stage 1 has no data for " + year + "; run precompute for the year.");
            }
        } catch (SQLException e) {
            checks.put("stage1", CheckResult.fail("query failed", Map.of("error", safe(e.getMessage()))));
            recommendations.add("Stage 1 could not be read; check the orbit_snapshots table.");
        }

        try {
            long candidates = candidateStore.countYear(year);
            if (candidates > 0L) {
                checks.put("stage2", CheckResult.ok("candidates present", Map.of("count", candidates)));
            } else {
                checks.put("stage2", CheckResult.fail("no candidates", Map.of("count", candidates)));
                recommendations.add("Stage 2 has no candidates for " + year + "; rerun from stage 2 after Stage 1 completes.");
            }
        } catch (SQLException e) {
            checks.put("stage2", CheckResult.fail("query failed", Map.of("error", safe(e.getMessage()))));
            recommendations.add("Stage 2 could not be read; check the fuji_candidates table.");
        }

        try {
            int locations = locationStore.findAll().size();
            int covered = eventStore.countLocationsWithEvents(year);
            double coverage = locations <= 0 ? 0.0 : covered / (double) locations;
            double threshold = config.getDouble("health.location_coverage_threshold", 0.5);
            Map<String, Object> evidence = Map.of("locations", locations, "with_events", covered, "coverage", coverage);
            if (locations == 0) {
                checks.put("stage3", CheckResult.warn("no locations registered", evidence));
                recommendations.add("No locations are registered; Stage 3 has nothing to match.");
            } else if (coverage >= threshold) {
                checks.put("stage3", CheckResult.ok("coverage above threshold", evidence));
            } else {
                checks.put("stage3", CheckResult.fail("coverage below threshold", evidence));
                recommendations.add(String.format(Locale.US,
                        "Only %d of %d locations have events for %d (%.0f%%); rerun Stage 3 or review locations beyond %s km.",
                        covered, locations, year, coverage * 100.0, config.getString("stage3.max_distance_km", "300")));
            }
        } catch (SQLException e) {
            checks.put("stage3", CheckResult.fail("query failed", Map.of("error", safe(e.getMessage()))));
            recommendations.add("Stage 3 could not be read; check the fuji_events and locations tables.");
        }

        boolean healthy = checks.values().stream().allMatch(CheckResult::healthy);
        if (healthy) {
            recommendations.clear();
            recommendations.add(HEALTHY_RECOMMENDATION);
        }
        return new HealthReport(healthy, year, checks, recommendations);
    }

    private PrecomputeResult execute(int year, boolean includeStage1, boolean resetCheckpoint, String mode) {
        ReentrantLock lock = yearLocks.computeIfAbsent(year, y -> new ReentrantLock());
        if (!lock.tryLock()) {
            return PrecomputeResult.failed(year, null, "run already in progress for year " + year, 0L, 0L, 0L, Map.of());
        }
        RunTelemetry telemetry = new RunTelemetry(year, mode, Instant.now());
        lastTelemetry = telemetry;
        cancelRequested.set(false);
        long started = System.currentTimeMillis();
        long dataPoints = 0L;
        long candidates = 0L;
        try {
            dataPoints = includeStage1 ? runStage1(year, resetCheckpoint, telemetry) : existingSnapshots(year);
            candidates = runStage2(year, telemetry);
            long events = runStage3(year, telemetry);
            EventStatistics statistics = statistics(year);
            state.set(OrchestratorState.DONE);
            telemetry.finish();
            System.out.println(telemetry.getSummary());
            return new PrecomputeResult(
                    true,
                    year,
                    dataPoints,
                    candidates,
                    events,
                    elapsed(started),
                    telemetry.stageBreakdown(),
                    null,
                    null,
                    statistics
            );
        } catch (StageFailureException e) {
            state.set(OrchestratorState.FAILED);
            telemetry.failStep(e.stage().stepName(), e.getMessage());
            telemetry.finish();
            System.err.println("Stage[" + e.stage().name().toLowerCase(Locale.ROOT) + "] aborted year=" + year + ", err=" + e.getMessage());
            System.out.println(telemetry.getSummary());
            return PrecomputeResult.failed(year, e.stage(), e.getMessage(), dataPoints, candidates,
                    elapsed(started), telemetry.stageBreakdown());
        } finally {
            lock.unlock();
        }
    }

    private long runStage1(int year, boolean resetCheckpoint, RunTelemetry telemetry) throws StageFailureException {
        PipelineStage stage = PipelineStage.STAGE1;
        enter(stage, telemetry);
        OrbitSnapshotGenerator.Summary summary;
        try {
            summary = stage1.generate(year, resetCheckpoint, cancelRequested::get);
        } catch (SQLException | RuntimeException e) {
            throw new StageFailureException(stage, "snapshot generation failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageFailureException(stage, "interrupted", e);
        }
        if (summary.cancelled()) {
            throw new StageFailureException(stage, "cancelled after chunk " + summary.chunksCompleted() + "/" + summary.chunkCount());
        }
        if (summary.snapshotsWritten() <= 0L) {
            throw new StageFailureException(stage, "no snapshots generated for year " + year);
        }
        telemetry.endStep(stage.stepName(), stage1.expectedSnapshots(year), summary.snapshotsWritten(), summary.daysSkipped(),
                summary.resumed() ? "resumed" : "");
        return summary.snapshotsWritten();
    }

    private long existingSnapshots(int year) throws StageFailureException {
        long count;
        try {
            count = snapshotStore.countYear(year);
        } catch (SQLException e) {
            throw new StageFailureException(PipelineStage.STAGE2, "cannot read stage1 data: " + e.getMessage(), e);
        }
        if (count <= 0L) {
            throw new StageFailureException(PipelineStage.STAGE2, "no stage1 data for year " + year);
        }
        return count;
    }

    private long runStage2(int year, RunTelemetry telemetry) throws StageFailureException {
        PipelineStage stage = PipelineStage.STAGE2;
        enter(stage, telemetry);
        try {
            CandidateFilter.Summary summary = stage2.filter(year);
            telemetry.endStep(stage.stepName(), summary.snapshotsScanned(), summary.candidatesWritten(), 0L);
            return summary.candidatesWritten();
        } catch (SQLException | RuntimeException e) {
            throw new StageFailureException(stage, "candidate filtering failed: " + e.getMessage(), e);
        }
    }

    private long runStage3(int year, RunTelemetry telemetry) throws StageFailureException {
        PipelineStage stage = PipelineStage.STAGE3;
        enter(stage, telemetry);
        LocationMatcher.Summary summary;
        try {
            summary = stage3.matchAll(year, cancelRequested::get);
        } catch (SQLException | RuntimeException e) {
            throw new StageFailureException(stage, "location matching failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageFailureException(stage, "interrupted", e);
        }
        if (summary.cancelled()) {
            throw new StageFailureException(stage, "cancelled");
        }
        if (summary.locations() > 0 && summary.failedLocations() >= summary.locations()) {
            throw new StageFailureException(stage, "all " + summary.locations() + " locations failed");
        }
        telemetry.endStep(stage.stepName(), summary.locations(), summary.eventsWritten(), summary.failedLocations(),
                "source=" + stage3.source());
        return summary.eventsWritten();
    }

    private EventStatistics statistics(int year) throws StageFailureException {
        try {
            return eventStore.statistics(year);
        } catch (SQLException e) {
            throw new StageFailureException(PipelineStage.STAGE3, "cannot read event statistics: " + e.getMessage(), e);
        }
    }

    private void enter(PipelineStage stage, RunTelemetry telemetry) {
        state.set(stage.runningState());
        telemetry.startStep(stage.stepName());
    }

    private long elapsed(long startedMillis) {
        return Math.max(0L, System.currentTimeMillis() - startedMillis);
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
