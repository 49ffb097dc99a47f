package com.fujical.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures one pipeline run's per-stage timings and counts.
 */
public final class RunTelemetry {
    public static final String STEP_STAGE1 = "STAGE1_ORBIT_SNAPSHOT";
    public static final String STEP_STAGE2 = "STAGE2_CANDIDATE_FILTER";
    public static final String STEP_STAGE3 = "STAGE3_LOCATION_MATCH";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final int year;
    private final String runMode;
    private final Instant startedAt;
    private Instant finishedAt;
    private String failedStep;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(int year, String runMode, Instant startedAt) {
        this.year = year;
        this.runMode = blankTo(runMode, "PRECOMPUTE");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.finishedAt = null;
        this.failedStep = "";
        this.errorsTotal = 0;
    }

    public synchronized int year() {
        return year;
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        if (errorCount > 0L) {
            errorsTotal += (int) Math.max(0L, errorCount);
        }
    }

    /**
     * Closes a step that aborted the run.
     */
    public synchronized void failStep(String name, String reason) {
        endStep(name, 0L, 0L, 1L, reason);
        failedStep = sanitizeStepName(name);
    }

    public synchronized String failedStep() {
        return failedStep;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    /**
     * Elapsed milliseconds per step, in execution order.
     */
    public synchronized Map<String, Long> stageBreakdown() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (StepStat stat : steps.values()) {
            out.put(stat.name, stat.elapsedMs);
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("year=").append(year).append('\n');
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        if (!failedStep.isEmpty()) {
            sb.append("failed_step=").append(failedStep).append('\n');
        }
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = optionalNote.trim();
        } else if (!stat.optionalNote.contains(optionalNote.trim())) {
            stat.optionalNote = stat.optionalNote + "; " + optionalNote.trim();
        }
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.elapsedMs = 0L;
            this.itemsIn = 0L;
            this.itemsOut = 0L;
            this.errorCount = 0L;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
