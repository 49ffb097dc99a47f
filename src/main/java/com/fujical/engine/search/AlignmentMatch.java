package com.fujical.engine.search;

import com.fujical.engine.model.AccuracyTier;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Best accepted instant for one sub-event window.
 */
public record AlignmentMatch(
        SubEvent subEvent,
        TargetVariant variant,
        Instant instant,
        double azimuth,
        double elevation,
        double targetElevation,
        double azimuthDiff,
        double elevationDiff,
        double score,
        Double moonPhase,
        Double moonIllumination
) {
    public AccuracyTier accuracyTier() {
        return AccuracyTier.classify(azimuthDiff, elevationDiff);
    }

    public FujiEvent toEvent(ObserverLocation location, LocalDate date, double qualityScore) {
        return new FujiEvent(
                location.id,
                date,
                instant,
                subEvent.phenomenonType(),
                azimuth,
                elevation,
                azimuthDiff,
                elevationDiff,
                qualityScore,
                moonPhase,
                moonIllumination
        );
    }
}
