package com.fujical.engine.search;

import com.fujical.engine.config.Config;

import java.time.ZonedDateTime;

/**
 * Quality score in [0,1]: geometric precision x base candidate quality x distance penalty.
 */
public final class QualityModel {
    private final double base;
    private final double penaltyStartKm;
    private final double penaltySpanKm;
    private final double penaltyFloor;

    public QualityModel(Config config) {
        this.base = config.getDouble("quality.base", 0.7);
        this.penaltyStartKm = config.getDouble("quality.distance_penalty_start_km", 150.0);
        this.penaltySpanKm = Math.max(1.0, config.getDouble("quality.distance_penalty_span_km", 200.0));
        this.penaltyFloor = config.getDouble("quality.distance_penalty_floor", 0.8);
    }

    /**
     * Seasonal and time-of-day visibility factor used as the base candidate quality.
     */
    public double atmosphericFactor(ZonedDateTime local) {
        double factor = base;
        int month = local.getMonthValue();
        if (month >= 11 || month <= 2) {
            factor += 0.2;
        } else if (month >= 6 && month <= 8) {
            factor -= 0.1;
        }
        int hour = local.getHour();
        if ((hour >= 5 && hour <= 7) || (hour >= 17 && hour <= 19)) {
            factor += 0.1;
        }
        return clamp01(factor);
    }

    public double precision(double azimuthDiff, double elevationDiff) {
        return Math.max(0.1, 1.0 - (Math.abs(azimuthDiff) + Math.abs(elevationDiff)) / 4.0);
    }

    public double distancePenalty(double distanceKm) {
        if (distanceKm <= penaltyStartKm) {
            return 1.0;
        }
        return Math.max(penaltyFloor, 1.0 - (distanceKm - penaltyStartKm) / penaltySpanKm);
    }

    public double score(double azimuthDiff, double elevationDiff, double baseQuality, double distanceKm) {
        return clamp01(precision(azimuthDiff, elevationDiff) * baseQuality * distancePenalty(distanceKm));
    }

    private static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
