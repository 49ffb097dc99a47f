package com.fujical.engine.runner;

public record RecomputeResult(
        boolean success,
        long locationId,
        int year,
        int eventCount,
        long timeMs,
        String error
) {
    public RecomputeResult {
        error = error == null ? "" : error;
    }

    static RecomputeResult failed(long locationId, int year, long timeMs, String error) {
        return new RecomputeResult(false, locationId, year, 0, timeMs, error);
    }
}
