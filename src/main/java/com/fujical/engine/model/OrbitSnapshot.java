package com.fujical.engine.model;

import java.time.Instant;

/**
 * One Stage-1 sample of a body against the reference observer.
 */
public final class OrbitSnapshot {
    public final int year;
    public final Instant instant;
    public final CelestialBody body;
    public final double azimuth;
    public final double elevation;
    public final boolean visible;
    public final Double moonPhase;
    public final Double moonIllumination;

    public OrbitSnapshot(
            int year,
            Instant instant,
            CelestialBody body,
            double azimuth,
            double elevation,
            boolean visible,
            Double moonPhase,
            Double moonIllumination
    ) {
        this.year = year;
        this.instant = instant;
        this.body = body;
        this.azimuth = azimuth;
        this.elevation = elevation;
        this.visible = visible;
        this.moonPhase = moonPhase;
        this.moonIllumination = moonIllumination;
    }
}
