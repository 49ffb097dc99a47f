package com.fujical.engine.search;

import com.fujical.engine.config.Config;
import com.fujical.engine.model.PhenomenonType;

/**
 * Acceptance tolerances for the direct search, scaled by distance to the summit.
 */
public final class ToleranceProfile {
    private final double closeKm;
    private final double mediumKm;
    private final double[] diamondAzimuth;
    private final double[] pearlAzimuth;
    private final double diamondElevation;
    private final double pearlElevation;

    public ToleranceProfile(Config config) {
        this.closeKm = config.getDouble("search.close_distance_km", 50.0);
        this.mediumKm = config.getDouble("search.medium_distance_km", 100.0);
        this.diamondAzimuth = new double[]{
                config.getDouble("search.diamond.azimuth_tolerance.close", 0.25),
                config.getDouble("search.diamond.azimuth_tolerance.medium", 0.4),
                config.getDouble("search.diamond.azimuth_tolerance.far", 0.6)
        };
        this.pearlAzimuth = new double[]{
                config.getDouble("search.pearl.azimuth_tolerance.close", 1.0),
                config.getDouble("search.pearl.azimuth_tolerance.medium", 2.0),
                config.getDouble("search.pearl.azimuth_tolerance.far", 3.0)
        };
        this.diamondElevation = config.getDouble("search.diamond.elevation_tolerance", 0.25);
        this.pearlElevation = config.getDouble("search.pearl.elevation_tolerance", 4.0);
    }

    public double azimuthTolerance(PhenomenonType type, double distanceKm) {
        double[] band = type.diamond() ? diamondAzimuth : pearlAzimuth;
        if (distanceKm <= closeKm) {
            return band[0];
        }
        if (distanceKm <= mediumKm) {
            return band[1];
        }
        return band[2];
    }

    public double elevationTolerance(PhenomenonType type) {
        return type.diamond() ? diamondElevation : pearlElevation;
    }
}
