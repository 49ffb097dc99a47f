package com.fujical.engine.stage;

import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.CelestialPosition;
import com.fujical.engine.ephemeris.CelestialPositionProvider;
import com.fujical.engine.ephemeris.ProviderUnavailableException;
import com.fujical.engine.geo.GeoPoint;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.OrbitSnapshot;
import com.fujical.engine.store.CheckpointStore;
import com.fujical.engine.store.OrbitSnapshotStore;
import org.json.JSONObject;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Stage 1: samples sun and moon positions for the whole year against the reference
 * observer and persists them in chunks, with a resumable checkpoint between chunks.
 */
public final class OrbitSnapshotGenerator {
    private final Config config;
    private final CelestialPositionProvider provider;
    private final OrbitSnapshotStore snapshotStore;
    private final CheckpointStore checkpointStore;
    private final ZoneId zone;

    public OrbitSnapshotGenerator(
            Config config,
            CelestialPositionProvider provider,
            OrbitSnapshotStore snapshotStore,
            CheckpointStore checkpointStore
    ) {
        this.config = config;
        this.provider = provider;
        this.snapshotStore = snapshotStore;
        this.checkpointStore = checkpointStore;
        this.zone = config.zone();
    }

    public Summary generate(int year) throws SQLException, InterruptedException {
        return generate(year, false, () -> false);
    }

    public Summary generate(int year, boolean resetCheckpoint, BooleanSupplier cancelled)
            throws SQLException, InterruptedException {
        ChunkPlan plan = preparePlan(year, resetCheckpoint);
        ChunkState state = loadState(plan);
        boolean resumed = state.nextChunkIndex > 0;
        if (resumed) {
            Instant from = plan.chunkStart(state.nextChunkIndex).atStartOfDay(zone).toInstant();
            Instant to = plan.yearEnd().atStartOfDay(zone).toInstant();
            int deleted = snapshotStore.deleteRange(year, from, to);
            System.out.println(String.format(
                    Locale.US,
                    "Stage1 resume year=%d chunk=%d/%d written=%d cleared_tail=%d",
                    year,
                    state.nextChunkIndex,
                    plan.chunkCount,
                    state.snapshotsWritten,
                    deleted
            ));
        } else {
            snapshotStore.deleteYear(year);
        }

        int threads = Math.max(1, config.getInt("stage1.threads", 4));
        int batchSize = Math.max(1, config.getInt("stage1.batch_size", 1000));
        int logEvery = Math.max(0, config.getInt("stage1.progress.log_every", 30));
        long startedNanos = System.nanoTime();
        boolean wasCancelled = false;
        int daysProcessed = 0;
        int totalDays = plan.remainingDays(state.nextChunkIndex);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            while (state.nextChunkIndex < plan.chunkCount) {
                if (cancelled.getAsBoolean()) {
                    wasCancelled = true;
                    System.out.println("Stage1 cancelled before chunk " + (state.nextChunkIndex + 1) + "/" + plan.chunkCount);
                    break;
                }
                LocalDate chunkStart = plan.chunkStart(state.nextChunkIndex);
                LocalDate chunkEnd = plan.chunkStart(state.nextChunkIndex + 1);
                List<LocalDate> days = new ArrayList<>();
                for (LocalDate d = chunkStart; d.isBefore(chunkEnd); d = d.plusDays(1)) {
                    days.add(d);
                }

                CompletionService<DaySamples> completion = new ExecutorCompletionService<>(pool);
                for (LocalDate day : days) {
                    completion.submit(() -> sampleDay(year, day));
                }
                List<OrbitSnapshot> chunkRows = new ArrayList<>();
                for (int i = 0; i < days.size(); i++) {
                    Future<DaySamples> future = completion.take();
                    try {
                        DaySamples samples = future.get();
                        if (samples.snapshots.isEmpty()) {
                            state.daysSkipped++;
                            System.err.println("Stage[stage1] skipped date=" + samples.date + ", failures=" + samples.failures);
                        } else {
                            chunkRows.addAll(samples.snapshots);
                            if (samples.failures > 0) {
                                System.err.println("Stage[stage1] partial date=" + samples.date + ", failures=" + samples.failures);
                            }
                        }
                    } catch (ExecutionException e) {
                        state.daysSkipped++;
                        Throwable cause = e.getCause() == null ? e : e.getCause();
                        System.err.println("Stage[stage1] failed err=" + cause.getMessage());
                    }
                    daysProcessed++;
                    if (shouldLogProgress(daysProcessed, totalDays, logEvery)) {
                        logProgress(year, daysProcessed, startedNanos);
                    }
                }

                chunkRows.sort(Comparator.comparing((OrbitSnapshot s) -> s.instant).thenComparing(s -> s.body));
                for (int from = 0; from < chunkRows.size(); from += batchSize) {
                    int to = Math.min(chunkRows.size(), from + batchSize);
                    state.snapshotsWritten += snapshotStore.insertBatch(chunkRows.subList(from, to));
                }
                state.nextChunkIndex++;
                saveCheckpoint(plan, state);
            }
        } finally {
            pool.shutdown();
        }

        if (!wasCancelled) {
            clearCheckpoint(plan);
        }
        long elapsedMs = Math.round((System.nanoTime() - startedNanos) / 1_000_000.0);
        System.out.println(String.format(
                Locale.US,
                "Stage1 done year=%d snapshots=%d days=%d skipped=%d resumed=%s cancelled=%s elapsed_ms=%d",
                year,
                state.snapshotsWritten,
                daysProcessed,
                state.daysSkipped,
                resumed,
                wasCancelled,
                elapsedMs
        ));
        return new Summary(
                year,
                state.snapshotsWritten,
                daysProcessed,
                state.daysSkipped,
                state.nextChunkIndex,
                plan.chunkCount,
                resumed,
                wasCancelled
        );
    }

    /**
     * Samples both bodies across one local day. A sample the provider cannot produce is
     * counted and left out.
     */
    public DaySamples sampleDay(int year, LocalDate date) {
        GeoPoint reference = referenceObserver();
        int interval = intervalMinutes();
        double sunVisible = config.getDouble("stage1.sun.visible_min_elevation", CelestialBody.SUN.defaultVisibleElevation());
        double moonVisible = config.getDouble("stage1.moon.visible_min_elevation", CelestialBody.MOON.defaultVisibleElevation());
        Instant start = date.atStartOfDay(zone).toInstant();
        Instant end = date.plusDays(1).atStartOfDay(zone).toInstant();

        List<OrbitSnapshot> rows = new ArrayList<>();
        int failures = 0;
        for (Instant t = start; t.isBefore(end); t = t.plusSeconds(interval * 60L)) {
            for (CelestialBody body : CelestialBody.values()) {
                CelestialPosition p;
                try {
                    p = provider.position(body, t, reference);
                } catch (ProviderUnavailableException e) {
                    failures++;
                    continue;
                }
                double visibleMin = body == CelestialBody.SUN ? sunVisible : moonVisible;
                rows.add(new OrbitSnapshot(
                        year,
                        t,
                        body,
                        p.azimuth,
                        p.elevation,
                        p.elevation > visibleMin,
                        p.moonPhase,
                        p.illuminatedFraction
                ));
            }
        }
        return new DaySamples(date, rows, failures);
    }

    /**
     * Samples a complete year should hold: days x samples per day x two bodies.
     */
    public long expectedSnapshots(int year) {
        long perDay = 1440L / intervalMinutes();
        return Year.of(year).length() * perDay * CelestialBody.values().length;
    }

    public void resetCheckpoint() throws SQLException {
        checkpointStore.delete(checkpointKey());
    }

    private int intervalMinutes() {
        return Math.max(1, config.getInt("stage1.interval_minutes", 5));
    }

    private String checkpointKey() {
        return config.getString("stage1.checkpoint_key", "stage1.orbit.checkpoint.v1");
    }

    private GeoPoint referenceObserver() {
        return new GeoPoint(
                config.getDouble("stage1.reference.latitude", 35.3628),
                config.getDouble("stage1.reference.longitude", 138.730781),
                config.getDouble("stage1.reference.elevation_m", 3776.0)
        );
    }

    private ChunkPlan preparePlan(int year, boolean resetCheckpoint) throws SQLException {
        boolean resumeEnabled = config.getBoolean("stage1.resume_enabled", true);
        int chunkDays = Math.max(1, config.getInt("stage1.chunk_days", 14));
        String key = checkpointKey();
        if (resetCheckpoint && resumeEnabled) {
            checkpointStore.delete(key);
        }
        return new ChunkPlan(year, chunkDays, resumeEnabled, key);
    }

    private ChunkState loadState(ChunkPlan plan) throws SQLException {
        ChunkState fresh = new ChunkState(0, 0L, 0);
        if (!plan.resumeEnabled) {
            return fresh;
        }
        Optional<String> raw = checkpointStore.get(plan.checkpointKey);
        if (raw.isEmpty() || raw.get().trim().isEmpty()) {
            return fresh;
        }

        Checkpoint checkpoint;
        try {
            checkpoint = Checkpoint.fromJson(raw.get());
        } catch (RuntimeException e) {
            System.err.println("WARN: invalid stage1 checkpoint, starting fresh: " + e.getMessage());
            clearCheckpoint(plan);
            return fresh;
        }
        if (checkpoint.year != plan.year
                || checkpoint.chunkDays != plan.chunkDays
                || checkpoint.chunkCount != plan.chunkCount) {
            clearCheckpoint(plan);
            return fresh;
        }
        int next = Math.max(0, Math.min(checkpoint.nextChunkIndex, plan.chunkCount));
        if (next >= plan.chunkCount) {
            clearCheckpoint(plan);
            return fresh;
        }
        return new ChunkState(next, checkpoint.snapshotsWritten, checkpoint.daysSkipped);
    }

    private void saveCheckpoint(ChunkPlan plan, ChunkState state) throws SQLException {
        if (!plan.resumeEnabled) {
            return;
        }
        Checkpoint checkpoint = new Checkpoint(
                plan.year,
                plan.chunkDays,
                plan.chunkCount,
                state.nextChunkIndex,
                state.snapshotsWritten,
                state.daysSkipped
        );
        checkpointStore.put(plan.checkpointKey, checkpoint.toJson().toString());
    }

    private void clearCheckpoint(ChunkPlan plan) throws SQLException {
        if (!plan.resumeEnabled) {
            return;
        }
        checkpointStore.delete(plan.checkpointKey);
    }

    private boolean shouldLogProgress(int completed, int total, int logEvery) {
        if (completed >= total) {
            return true;
        }
        if (logEvery <= 0) {
            return false;
        }
        return completed % logEvery == 0;
    }

    private void logProgress(int year, int daysProcessed, long startedNanos) {
        long elapsedSec = Math.max(0L, Math.round((System.nanoTime() - startedNanos) / 1_000_000_000.0));
        System.out.println(String.format(
                Locale.US,
                "Stage1 progress year=%d days=%d elapsed=%ds",
                year,
                daysProcessed,
                elapsedSec
        ));
    }

    public record Summary(
            int year,
            long snapshotsWritten,
            int daysProcessed,
            int daysSkipped,
            int chunksCompleted,
            int chunkCount,
            boolean resumed,
            boolean cancelled
    ) {
        public boolean complete() {
            return !cancelled && chunksCompleted >= chunkCount;
        }
    }

    public static final class DaySamples {
        public final LocalDate date;
        public final List<OrbitSnapshot> snapshots;
        public final int failures;

        private DaySamples(LocalDate date, List<OrbitSnapshot> snapshots, int failures) {
            this.date = date;
            this.snapshots = snapshots;
            this.failures = failures;
        }
    }

    private static final class ChunkPlan {
        final int year;
        final int chunkDays;
        final int chunkCount;
        final boolean resumeEnabled;
        final String checkpointKey;
        final LocalDate yearStart;

        private ChunkPlan(int year, int chunkDays, boolean resumeEnabled, String checkpointKey) {
            this.year = year;
            this.chunkDays = chunkDays;
            this.resumeEnabled = resumeEnabled;
            this.checkpointKey = checkpointKey;
            this.yearStart = LocalDate.of(year, 1, 1);
            int days = Year.of(year).length();
            this.chunkCount = (days + chunkDays - 1) / chunkDays;
        }

        LocalDate yearEnd() {
            return yearStart.plusYears(1);
        }

        LocalDate chunkStart(int index) {
            LocalDate start = yearStart.plusDays((long) index * chunkDays);
            return start.isAfter(yearEnd()) ? yearEnd() : start;
        }

        int remainingDays(int fromChunk) {
            return (int) (yearEnd().toEpochDay() - chunkStart(fromChunk).toEpochDay());
        }
    }

    private static final class ChunkState {
        int nextChunkIndex;
        long snapshotsWritten;
        int daysSkipped;

        private ChunkState(int nextChunkIndex, long snapshotsWritten, int daysSkipped) {
            this.nextChunkIndex = nextChunkIndex;
            this.snapshotsWritten = snapshotsWritten;
            this.daysSkipped = daysSkipped;
        }
    }

    private static final class Checkpoint {
        final int year;
        final int chunkDays;
        final int chunkCount;
        final int nextChunkIndex;
        final long snapshotsWritten;
        final int daysSkipped;

        private Checkpoint(int year, int chunkDays, int chunkCount, int nextChunkIndex, long snapshotsWritten, int daysSkipped) {
            this.year = year;
            this.chunkDays = chunkDays;
            this.chunkCount = chunkCount;
            this.nextChunkIndex = nextChunkIndex;
            this.snapshotsWritten = snapshotsWritten;
            this.daysSkipped = daysSkipped;
        }

        JSONObject toJson() {
            JSONObject root = new JSONObject();
            root.put("version", 1);
            root.put("year", year);
            root.put("chunk_days", chunkDays);
            root.put("chunk_count", chunkCount);
            root.put("next_chunk_index", nextChunkIndex);
            root.put("snapshots_written", snapshotsWritten);
            root.put("days_skipped", daysSkipped);
            return root;
        }

        static Checkpoint fromJson(String raw) {
            JSONObject root = new JSONObject(raw);
            return new Checkpoint(
                    root.getInt("year"),
                    root.optInt("chunk_days", 0),
                    root.optInt("chunk_count", 0),
                    root.optInt("next_chunk_index", 0),
                    root.optLong("snapshots_written", 0L),
                    root.optInt("days_skipped", 0)
            );
        }
    }
}
