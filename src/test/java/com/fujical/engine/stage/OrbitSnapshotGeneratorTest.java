package com.fujical.engine.stage;

import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.ScriptedProvider;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.OrbitSnapshot;
import com.fujical.engine.store.InMemoryCheckpointStore;
import com.fujical.engine.store.InMemoryOrbitSnapshotStore;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrbitSnapshotGeneratorTest {

    private static final String CHECKPOINT_KEY = "stage1.orbit.checkpoint.v1";
    private static final int YEAR = 2025;
    private static final long HOURLY_YEAR = 365L * 24L * 2L;

    private final InMemoryOrbitSnapshotStore snapshots = new InMemoryOrbitSnapshotStore();
    private final InMemoryCheckpointStore checkpoints = new InMemoryCheckpointStore();

    private Config hourly() {
        return Config.of(Map.of(
                "stage1.interval_minutes", "60",
                "stage1.chunk_days", "30",
                "stage1.threads", "2",
                "stage1.batch_size", "500"
        ));
    }

    @Test
    void generateShouldWriteEverySampleOfTheYear() throws Exception {
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);

        OrbitSnapshotGenerator.Summary summary = generator.generate(YEAR);

        assertEquals(HOURLY_YEAR, summary.snapshotsWritten());
        assertEquals(HOURLY_YEAR, snapshots.countYear(YEAR));
        assertEquals(HOURLY_YEAR, generator.expectedSnapshots(YEAR));
        assertEquals(365, summary.daysProcessed());
        assertEquals(13, summary.chunkCount());
        assertTrue(summary.complete());
        assertFalse(summary.resumed());
        assertFalse(checkpoints.contains(CHECKPOINT_KEY));
    }

    @Test
    void generateShouldReplaceThePreviousRunOfTheYear() throws Exception {
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);

        generator.generate(YEAR);
        generator.generate(YEAR);

        assertEquals(HOURLY_YEAR, snapshots.countYear(YEAR));
    }

    @Test
    void cancelledRunShouldResumeFromTheNextChunk() throws Exception {
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);
        AtomicInteger checks = new AtomicInteger();

        OrbitSnapshotGenerator.Summary first = generator.generate(YEAR, false, () -> checks.incrementAndGet() > 2);

        assertTrue(first.cancelled());
        assertEquals(2, first.chunksCompleted());
        assertEquals(60L * 24L * 2L, snapshots.countYear(YEAR));
        JSONObject checkpoint = new JSONObject(checkpoints.get(CHECKPOINT_KEY).orElseThrow());
        assertEquals(2, checkpoint.getInt("next_chunk_index"));
        assertEquals(YEAR, checkpoint.getInt("year"));

        OrbitSnapshotGenerator.Summary second = generator.generate(YEAR);

        assertTrue(second.resumed());
        assertTrue(second.complete());
        assertEquals(HOURLY_YEAR, second.snapshotsWritten());
        assertEquals(HOURLY_YEAR, snapshots.countYear(YEAR));
        assertEquals(305, second.daysProcessed());
        assertFalse(checkpoints.contains(CHECKPOINT_KEY));
    }

    @Test
    void resetCheckpointShouldStartTheYearOver() throws Exception {
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);
        AtomicInteger checks = new AtomicInteger();
        generator.generate(YEAR, false, () -> checks.incrementAndGet() > 1);

        OrbitSnapshotGenerator.Summary summary = generator.generate(YEAR, true, () -> false);

        assertFalse(summary.resumed());
        assertEquals(365, summary.daysProcessed());
        assertEquals(HOURLY_YEAR, snapshots.countYear(YEAR));
    }

    @Test
    void unreadableCheckpointShouldBeDiscarded() throws Exception {
        checkpoints.put(CHECKPOINT_KEY, "{not json");
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);

        OrbitSnapshotGenerator.Summary summary = generator.generate(YEAR);

        assertFalse(summary.resumed());
        assertEquals(HOURLY_YEAR, summary.snapshotsWritten());
    }

    @Test
    void checkpointForAnotherYearShouldBeIgnored() throws Exception {
        checkpoints.put(CHECKPOINT_KEY, new JSONObject()
                .put("year", 2024)
                .put("chunk_days", 30)
                .put("chunk_count", 13)
                .put("next_chunk_index", 5)
                .toString());
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);

        OrbitSnapshotGenerator.Summary summary = generator.generate(YEAR);

        assertFalse(summary.resumed());
        assertEquals(365, summary.daysProcessed());
    }

    @Test
    void dayWithoutAnyPositionShouldBeSkipped() throws Exception {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        LocalDate outage = LocalDate.of(YEAR, 3, 1);
        ScriptedProvider provider = new ScriptedProvider()
                .unavailableWhen(t -> t.atZone(tokyo).toLocalDate().equals(outage));
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), provider, snapshots, checkpoints);

        OrbitSnapshotGenerator.Summary summary = generator.generate(YEAR);

        assertEquals(1, summary.daysSkipped());
        assertEquals(HOURLY_YEAR - 48L, snapshots.countYear(YEAR));
    }

    @Test
    void sampleDayShouldCoverBothBodiesAndFlagVisibility() {
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(hourly(), new ScriptedProvider(), snapshots, checkpoints);

        OrbitSnapshotGenerator.DaySamples samples = generator.sampleDay(YEAR, LocalDate.of(YEAR, 6, 1));

        assertEquals(48, samples.snapshots.size());
        assertEquals(0, samples.failures);
        long moons = samples.snapshots.stream().filter(s -> s.body == CelestialBody.MOON).count();
        assertEquals(24L, moons);
        for (OrbitSnapshot s : samples.snapshots) {
            assertFalse(s.visible);
            assertEquals(YEAR, s.year);
        }
    }

    @Test
    void expectedSnapshotsShouldCountLeapDays() {
        OrbitSnapshotGenerator generator = new OrbitSnapshotGenerator(
                Config.defaultsOnly(), new ScriptedProvider(), snapshots, checkpoints);

        assertEquals(366L * 288L * 2L, generator.expectedSnapshots(2024));
        assertEquals(365L * 288L * 2L, generator.expectedSnapshots(2025));
    }
}
