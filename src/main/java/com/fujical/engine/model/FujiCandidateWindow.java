package com.fujical.engine.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Stage-2 candidate: one plausible sample per (date, phenomenon, day part).
 */
public final class FujiCandidateWindow {
    public final int year;
    public final LocalDate date;
    public final Instant instant;
    public final CelestialBody body;
    public final PhenomenonType phenomenonType;
    public final DayPart dayPart;
    public final double azimuth;
    public final double elevation;
    public final Double moonPhase;
    public final Double moonIllumination;
    public final double atmosphericFactor;

    public FujiCandidateWindow(
            int year,
            LocalDate date,
            Instant instant,
            CelestialBody body,
            PhenomenonType phenomenonType,
            DayPart dayPart,
            double azimuth,
            double elevation,
            Double moonPhase,
            Double moonIllumination,
            double atmosphericFactor
    ) {
        this.year = year;
        this.date = date;
        this.instant = instant;
        this.body = body;
        this.phenomenonType = phenomenonType;
        this.dayPart = dayPart;
        this.azimuth = azimuth;
        this.elevation = elevation;
        this.moonPhase = moonPhase;
        this.moonIllumination = moonIllumination;
        this.atmosphericFactor = atmosphericFactor;
    }
}
