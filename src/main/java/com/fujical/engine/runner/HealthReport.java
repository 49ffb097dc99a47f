package com.fujical.engine.runner;

import com.fujical.core.CheckResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-stage checks in a fixed order: database, stage1, stage2, stage3.
 */
public record HealthReport(
        boolean healthy,
        int year,
        Map<String, CheckResult> checks,
        List<String> recommendations
) {
    public HealthReport {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks == null ? Map.of() : checks));
        recommendations = List.copyOf(recommendations == null ? List.of() : recommendations);
    }
}
