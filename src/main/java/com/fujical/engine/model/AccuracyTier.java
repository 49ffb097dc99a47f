package com.fujical.engine.model;

import java.util.Locale;

/**
 * Disjoint bands over totalDiff = sqrt(azimuthDiff^2 + elevationDiff^2), strictest first.
 */
public enum AccuracyTier {
    PERFECT(0.3),
    EXCELLENT(0.7),
    GOOD(1.2),
    FAIR(Double.POSITIVE_INFINITY);

    private final double maxTotalDiff;

    AccuracyTier(double maxTotalDiff) {
        this.maxTotalDiff = maxTotalDiff;
    }

    public static double totalDiff(double azimuthDiff, double elevationDiff) {
        return Math.sqrt(azimuthDiff * azimuthDiff + elevationDiff * elevationDiff);
    }

    public static AccuracyTier classify(double azimuthDiff, double elevationDiff) {
        double total = totalDiff(Math.abs(azimuthDiff), Math.abs(elevationDiff));
        for (AccuracyTier tier : values()) {
            if (total <= tier.maxTotalDiff) {
                return tier;
            }
        }
        return FAIR;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AccuracyTier fromCode(String raw) {
        return AccuracyTier.valueOf(raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT));
    }
}
