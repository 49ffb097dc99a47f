package com.fujical.engine.ephemeris;

import com.fujical.engine.model.CelestialBody;

/**
 * Apparent horizontal position of a body for one instant and observer.
 * Moon phase and illuminated fraction are null for the Sun.
 */
public final class CelestialPosition {
    public final CelestialBody body;
    public final double azimuth;
    public final double elevation;
    public final double distanceKm;
    public final Double moonPhase;
    public final Double illuminatedFraction;

    public CelestialPosition(
            CelestialBody body,
            double azimuth,
            double elevation,
            double distanceKm,
            Double moonPhase,
            Double illuminatedFraction
    ) {
        this.body = body;
        this.azimuth = azimuth;
        this.elevation = elevation;
        this.distanceKm = distanceKm;
        this.moonPhase = moonPhase;
        this.illuminatedFraction = illuminatedFraction;
    }

    public static CelestialPosition sun(double azimuth, double elevation, double distanceKm) {
        return new CelestialPosition(CelestialBody.SUN, azimuth, elevation, distanceKm, null, null);
    }

    public static CelestialPosition moon(
            double azimuth,
            double elevation,
            double distanceKm,
            double phase,
            double illuminatedFraction
    ) {
        return new CelestialPosition(CelestialBody.MOON, azimuth, elevation, distanceKm, phase, illuminatedFraction);
    }
}
