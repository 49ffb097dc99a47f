package com.fujical.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one health check with the numbers behind it.
 */
public record CheckResult(
        CheckStatus status,
        String reason,
        Map<String, Object> evidence
) {
    public CheckResult {
        status = status == null ? CheckStatus.FAIL : status;
        reason = reason == null ? "" : reason;
        Map<String, Object> copy = evidence == null ? Map.of() : new LinkedHashMap<>(evidence);
        evidence = Map.copyOf(copy);
    }

    public static CheckResult ok(String reason, Map<String, Object> evidence) {
        return new CheckResult(CheckStatus.OK, reason, evidence);
    }

    public static CheckResult warn(String reason, Map<String, Object> evidence) {
        return new CheckResult(CheckStatus.WARN, reason, evidence);
    }

    public static CheckResult fail(String reason, Map<String, Object> evidence) {
        return new CheckResult(CheckStatus.FAIL, reason, evidence);
    }

    public boolean healthy() {
        return status == CheckStatus.OK;
    }
}
