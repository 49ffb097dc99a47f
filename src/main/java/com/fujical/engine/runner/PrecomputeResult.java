package com.fujical.engine.runner;

import com.fujical.engine.model.EventStatistics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PrecomputeResult(
        boolean success,
        int year,
        long totalDataPoints,
        long totalCandidates,
        long totalEvents,
        long timeMs,
        Map<String, Long> stageBreakdown,
        PipelineStage failedStage,
        String error,
        EventStatistics statistics
) {
    public PrecomputeResult {
        stageBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(stageBreakdown == null ? Map.of() : stageBreakdown));
        error = error == null ? "" : error;
        statistics = statistics == null ? EventStatistics.empty(year) : statistics;
    }

    static PrecomputeResult failed(
            int year,
            PipelineStage stage,
            String error,
            long dataPoints,
            long candidates,
            long timeMs,
            Map<String, Long> stageBreakdown
    ) {
        return new PrecomputeResult(false, year, dataPoints, candidates, 0L, timeMs, stageBreakdown, stage, error, null);
    }
}
