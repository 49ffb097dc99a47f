package com.fujical.engine.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A Diamond or Pearl Fuji alignment seen from one location.
 */
public final class FujiEvent {
    public final long locationId;
    public final LocalDate date;
    public final Instant instant;
    public final PhenomenonType phenomenonType;
    public final double azimuth;
    public final double elevation;
    public final double azimuthDiff;
    public final double elevationDiff;
    public final double totalDiff;
    public final AccuracyTier accuracyTier;
    public final double qualityScore;
    public final Double moonPhase;
    public final Double moonIllumination;

    public FujiEvent(
            long locationId,
            LocalDate date,
            Instant instant,
            PhenomenonType phenomenonType,
            double azimuth,
            double elevation,
            double azimuthDiff,
            double elevationDiff,
            double qualityScore,
            Double moonPhase,
            Double moonIllumination
    ) {
        this.locationId = locationId;
        this.date = date;
        this.instant = instant;
        this.phenomenonType = phenomenonType;
        this.azimuth = azimuth;
        this.elevation = elevation;
        this.azimuthDiff = Math.abs(azimuthDiff);
        this.elevationDiff = Math.abs(elevationDiff);
        this.totalDiff = AccuracyTier.totalDiff(this.azimuthDiff, this.elevationDiff);
        this.accuracyTier = AccuracyTier.classify(this.azimuthDiff, this.elevationDiff);
        this.qualityScore = Math.max(0.0, Math.min(1.0, qualityScore));
        this.moonPhase = moonPhase;
        this.moonIllumination = moonIllumination;
    }

    public int year() {
        return date.getYear();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FujiEvent other)) {
            return false;
        }
        return locationId == other.locationId
                && Objects.equals(date, other.date)
                && Objects.equals(instant, other.instant)
                && phenomenonType == other.phenomenonType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(locationId, date, instant, phenomenonType);
    }

    @Override
    public String toString() {
        return "FujiEvent{location=" + locationId + ", date=" + date + ", instant=" + instant
                + ", type=" + phenomenonType.code() + ", tier=" + accuracyTier.code()
                + ", quality=" + qualityScore + "}";
    }
}
