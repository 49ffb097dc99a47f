package com.fujical.engine.stage;

import java.util.Locale;

/**
 * Which precomputed table Stage 3 reads positions from.
 */
public enum MatchSource {
    STAGE1,
    STAGE2;

    public static MatchSource parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return STAGE1;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown stage3.source: " + raw, e);
        }
    }
}
