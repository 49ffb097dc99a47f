package com.fujical.engine.runner;

import com.fujical.core.CheckStatus;
import com.fujical.core.RunTelemetry;
import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.CelestialPositionProvider;
import com.fujical.engine.ephemeris.ScriptedProvider;
import com.fujical.engine.model.AccuracyTier;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.store.InMemoryCandidateStore;
import com.fujical.engine.store.InMemoryCheckpointStore;
import com.fujical.engine.store.InMemoryFujiEventStore;
import com.fujical.engine.store.InMemoryLocationStore;
import com.fujical.engine.store.InMemoryOrbitSnapshotStore;
import com.fujical.engine.store.StoreHealth;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FujiOrchestratorTest {

    private static final int YEAR = 2025;
    private static final long HOURLY_YEAR = 365L * 24L * 2L;
    private static final ObserverLocation EAST = ObserverLocation.of(1L, "east", 35.3628, 139.5, 0.0);
    private static final Instant SUNSET_PASS = Instant.parse("2025-02-10T08:00:00Z");

    private final InMemoryOrbitSnapshotStore snapshots = new InMemoryOrbitSnapshotStore();
    private final InMemoryCandidateStore candidates = new InMemoryCandidateStore();
    private final InMemoryFujiEventStore events = new InMemoryFujiEventStore();
    private final InMemoryCheckpointStore checkpoints = new InMemoryCheckpointStore();

    private static Config hourly() {
        return Config.of(Map.of(
                "stage1.interval_minutes", "60",
                "stage1.chunk_days", "60",
                "stage1.threads", "2",
                "stage3.threads", "2"
        ));
    }

    private static ScriptedProvider sunsetOverEast() {
        return new ScriptedProvider()
                .track(CelestialBody.SUN, SUNSET_PASS, EAST.fujiBearing, EAST.fujiElevation, 0.004, 0.003, 0.0);
    }

    private FujiOrchestrator orchestrator(CelestialPositionProvider provider, InMemoryLocationStore locations, StoreHealth health) {
        return new FujiOrchestrator(hourly(), provider, snapshots, candidates, events, locations, checkpoints, health);
    }

    private FujiOrchestrator orchestrator(CelestialPositionProvider provider) {
        return orchestrator(provider, new InMemoryLocationStore(EAST), () -> { });
    }

    @Test
    void precomputeYearShouldRunAllStagesAndReportCounts() {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());

        PrecomputeResult result = orchestrator.precomputeYear(YEAR);

        assertTrue(result.success(), result.error());
        assertEquals(HOURLY_YEAR, result.totalDataPoints());
        assertTrue(result.totalCandidates() > 0L);
        assertEquals(candidates.countYear(YEAR), result.totalCandidates());
        assertEquals(1L, result.totalEvents());
        assertNull(result.failedStage());
        assertEquals(OrchestratorState.DONE, orchestrator.state());
        assertEquals(
                List.of(RunTelemetry.STEP_STAGE1, RunTelemetry.STEP_STAGE2, RunTelemetry.STEP_STAGE3),
                new ArrayList<>(result.stageBreakdown().keySet()));

        assertEquals(1L, result.statistics().totalEvents());
        assertEquals(1L, result.statistics().byPhenomenon().get(PhenomenonType.DIAMOND_SUNSET));
        assertEquals(1L, result.statistics().byTier().get(AccuracyTier.PERFECT));
        assertEquals(1, result.statistics().locationsWithEvents());

        FujiEvent stored = events.all().get(0);
        assertEquals(SUNSET_PASS, stored.instant);
        assertEquals(LocalDate.of(2025, 2, 10), stored.date);
    }

    @Test
    void precomputeYearTwiceShouldLeaveTheSameData() throws Exception {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());

        PrecomputeResult first = orchestrator.precomputeYear(YEAR);
        PrecomputeResult second = orchestrator.precomputeYear(YEAR);

        assertEquals(first.totalDataPoints(), second.totalDataPoints());
        assertEquals(first.totalCandidates(), second.totalCandidates());
        assertEquals(first.totalEvents(), second.totalEvents());
        assertEquals(HOURLY_YEAR, snapshots.countYear(YEAR));
        assertEquals(first.totalCandidates(), candidates.countYear(YEAR));
        assertEquals(first.totalEvents(), events.countYear(YEAR));
    }

    @Test
    void providerOutageShouldFailStageOne() {
        FujiOrchestrator orchestrator = orchestrator(new ScriptedProvider().unavailableWhen(t -> true));

        PrecomputeResult result = orchestrator.precomputeYear(YEAR);

        assertFalse(result.success());
        assertEquals(PipelineStage.STAGE1, result.failedStage());
        assertEquals(0L, result.totalEvents());
        assertEquals(OrchestratorState.FAILED, orchestrator.state());
        assertEquals(RunTelemetry.STEP_STAGE1, orchestrator.lastTelemetry().orElseThrow().failedStep());
    }

    @Test
    void cancelDuringStageOneShouldAbortTheRun() {
        AtomicReference<FujiOrchestrator> ref = new AtomicReference<>();
        ScriptedProvider provider = sunsetOverEast().unavailableWhen(t -> {
            ref.get().cancel();
            return false;
        });
        FujiOrchestrator orchestrator = orchestrator(provider);
        ref.set(orchestrator);

        PrecomputeResult result = orchestrator.precomputeYear(YEAR);

        assertFalse(result.success());
        assertEquals(PipelineStage.STAGE1, result.failedStage());
        assertTrue(result.error().contains("cancelled"), result.error());
        assertTrue(checkpoints.contains("stage1.orbit.checkpoint.v1"));
    }

    @Test
    void executeFromStage2WithoutSnapshotsShouldFailStageTwo() {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());

        PrecomputeResult result = orchestrator.executeFromStage2(YEAR);

        assertFalse(result.success());
        assertEquals(PipelineStage.STAGE2, result.failedStage());
    }

    @Test
    void executeFromStage2ShouldReuseExistingSnapshots() throws Exception {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());
        orchestrator.precomputeYear(YEAR);
        int insertsBefore = snapshots.insertCalls;

        PrecomputeResult result = orchestrator.executeFromStage2(YEAR);

        assertTrue(result.success(), result.error());
        assertEquals(HOURLY_YEAR, result.totalDataPoints());
        assertEquals(1L, result.totalEvents());
        assertEquals(insertsBefore, snapshots.insertCalls);
        assertEquals(1L, events.countYear(YEAR));
    }

    @Test
    void healthCheckShouldReportHealthyAfterFullRun() {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());
        orchestrator.precomputeYear(YEAR);

        HealthReport report = orchestrator.healthCheck(YEAR);

        assertTrue(report.healthy());
        assertEquals(List.of("database", "stage1", "stage2", "stage3"), new ArrayList<>(report.checks().keySet()));
        assertEquals(List.of(FujiOrchestrator.HEALTHY_RECOMMENDATION), report.recommendations());
    }

    @Test
    void healthCheckShouldExplainEveryFailingStage() {
        FujiOrchestrator orchestrator = orchestrator(
                sunsetOverEast(),
                new InMemoryLocationStore(),
                () -> {
                    throw new SQLException("connection refused");
                });

        HealthReport report = orchestrator.healthCheck(YEAR);

        assertFalse(report.healthy());
        assertEquals(CheckStatus.FAIL, report.checks().get("database").status());
        assertEquals(CheckStatus.FAIL, report.checks().get("stage1").status());
        assertEquals(CheckStatus.FAIL, report.checks().get("stage2").status());
        assertEquals(CheckStatus.WARN, report.checks().get("stage3").status());
        assertEquals(4, report.recommendations().size());
        assertFalse(report.recommendations().contains(FujiOrchestrator.HEALTHY_RECOMMENDATION));
    }

    @Test
    void recomputeLocationShouldRematchOnlyThatLocation() throws Exception {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());
        orchestrator.precomputeYear(YEAR);

        RecomputeResult result = orchestrator.recomputeLocation(EAST.id, YEAR);

        assertTrue(result.success(), result.error());
        assertEquals(1, result.eventCount());
        assertEquals(1L, events.countYear(YEAR));
    }

    @Test
    void recomputeLocationShouldReportUnknownLocation() {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());
        orchestrator.precomputeYear(YEAR);

        RecomputeResult result = orchestrator.recomputeLocation(99L, YEAR);

        assertFalse(result.success());
        assertTrue(result.error().contains("not found"), result.error());
    }

    @Test
    void recomputeLocationShouldRequirePrecomputedYear() {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());

        RecomputeResult result = orchestrator.recomputeLocation(EAST.id, YEAR);

        assertFalse(result.success());
        assertTrue(result.error().contains("no precomputed"), result.error());
    }

    @Test
    void computeDayEventsShouldNotNeedPrecomputedData() throws Exception {
        FujiOrchestrator orchestrator = orchestrator(sunsetOverEast());

        List<FujiEvent> day = orchestrator.computeDayEvents(LocalDate.of(2025, 2, 10), EAST);

        assertEquals(1, day.size());
        assertEquals(SUNSET_PASS, day.get(0).instant);
        assertEquals(0L, snapshots.countYear(YEAR));
        assertEquals(OrchestratorState.IDLE, orchestrator.state());
    }
}
