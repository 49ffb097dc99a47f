package com.fujical.engine.search;

import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.CelestialPosition;
import com.fujical.engine.ephemeris.CelestialPositionProvider;
import com.fujical.engine.ephemeris.ProviderUnavailableException;
import com.fujical.engine.geo.GeoAstronomy;
import com.fujical.engine.geo.GeoPoint;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.model.PhenomenonType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Coarse-to-fine search for the instant a body best sits on the summit as seen from a location.
 */
public final class AlignmentSearch {
    private static final Logger LOG = LogManager.getLogger(AlignmentSearch.class);
    private static final double SCORE_EPSILON = 1e-9;

    private final CelestialPositionProvider provider;
    private final ZoneId zone;
    private final ToleranceProfile tolerances;
    private final QualityModel qualityModel;
    private final int coarseStepSeconds;
    private final int settingCoarseStepSeconds;
    private final int fineStepSeconds;
    private final int settingFineStepSeconds;
    private final int fineSpanSeconds;
    private final double escalationThreshold;
    private final double pearlMinIllumination;

    public AlignmentSearch(CelestialPositionProvider provider, Config config) {
        this.provider = provider;
        this.zone = config.zone();
        this.tolerances = new ToleranceProfile(config);
        this.qualityModel = new QualityModel(config);
        this.coarseStepSeconds = Math.max(1, config.getInt("search.coarse_step_seconds", 30));
        this.settingCoarseStepSeconds = Math.max(1, config.getInt("search.setting.coarse_step_seconds", 20));
        this.fineStepSeconds = Math.max(1, config.getInt("search.fine_step_seconds", 10));
        this.settingFineStepSeconds = Math.max(1, config.getInt("search.setting.fine_step_seconds", 5));
        this.fineSpanSeconds = Math.max(1, config.getInt("search.fine_span_minutes", 2)) * 60;
        this.escalationThreshold = config.getDouble("search.escalation_threshold", 3.0);
        this.pearlMinIllumination = config.getDouble("search.pearl.min_illumination", 0.1);
    }

    /**
     * All accepted alignments for the local date, ordered by instant.
     */
    public List<FujiEvent> computeDayEvents(LocalDate date, ObserverLocation location) {
        List<FujiEvent> events = new ArrayList<>();
        for (SubEvent subEvent : SubEvent.values()) {
            Optional<AlignmentMatch> match = search(date, location, subEvent);
            if (match.isEmpty()) {
                continue;
            }
            AlignmentMatch m = match.get();
            double base = qualityModel.atmosphericFactor(m.instant().atZone(zone));
            double quality = qualityModel.score(m.azimuthDiff(), m.elevationDiff(), base, location.fujiDistanceKm());
            events.add(m.toEvent(location, date, quality));
        }
        events.sort(Comparator.comparing((FujiEvent e) -> e.instant));
        return events;
    }

    /**
     * Best accepted match inside the sub-event window, or empty when nothing aligns.
     * Only positions in the sub-event's half of the sky are considered.
     */
    public Optional<AlignmentMatch> search(LocalDate date, ObserverLocation location, SubEvent subEvent) {
        SearchWindow window = subEvent.window(date, zone);
        CelestialBody body = subEvent.body();
        GeoPoint observer = location.point();
        List<TargetVariant> variants = TargetVariant.forBody(body);
        boolean setting = subEvent == SubEvent.SETTING;

        AlignmentMatch[] best = new AlignmentMatch[variants.size()];
        int coarseStep = setting ? settingCoarseStepSeconds : coarseStepSeconds;
        for (Instant t = window.start(); t.isBefore(window.end()); t = t.plusSeconds(coarseStep)) {
            scan(subEvent, location, observer, variants, t, best, -1);
        }

        int fineStep = setting ? settingFineStepSeconds : fineStepSeconds;
        for (int i = 0; i < best.length; i++) {
            AlignmentMatch coarse = best[i];
            if (coarse == null || coarse.score() >= escalationThreshold) {
                continue;
            }
            Instant from = window.clamp(coarse.instant().minusSeconds(fineSpanSeconds));
            Instant to = window.clamp(coarse.instant().plusSeconds(fineSpanSeconds));
            for (Instant t = from; !t.isAfter(to); t = t.plusSeconds(fineStep)) {
                if (window.contains(t)) {
                    scan(subEvent, location, observer, variants, t, best, i);
                }
            }
        }

        PhenomenonType type = subEvent.phenomenonType();
        double azimuthTolerance = tolerances.azimuthTolerance(type, location.fujiDistanceKm());
        double elevationTolerance = tolerances.elevationTolerance(type);
        AlignmentMatch chosen = null;
        for (AlignmentMatch candidate : best) {
            if (candidate == null) {
                continue;
            }
            if (candidate.azimuthDiff() > azimuthTolerance || candidate.elevationDiff() > elevationTolerance) {
                continue;
            }
            if (body == CelestialBody.MOON) {
                Double illumination = candidate.moonIllumination();
                if (illumination == null || illumination < pearlMinIllumination) {
                    continue;
                }
            }
            // variants are in tie-break order, so an equal score keeps the earlier one
            if (chosen == null || candidate.score() < chosen.score() - SCORE_EPSILON) {
                chosen = candidate;
            }
        }
        if (chosen != null && LOG.isDebugEnabled()) {
            LOG.debug("alignment location={} date={} sub_event={} variant={} at={} az_diff={} el_diff={}",
                    location.id, date, subEvent.code(), chosen.variant(), chosen.instant(),
                    chosen.azimuthDiff(), chosen.elevationDiff());
        }
        return Optional.ofNullable(chosen);
    }

    private void scan(
            SubEvent subEvent,
            ObserverLocation location,
            GeoPoint observer,
            List<TargetVariant> variants,
            Instant instant,
            AlignmentMatch[] best,
            int onlyVariant
    ) {
        CelestialPosition position;
        try {
            position = provider.position(subEvent.body(), instant, observer);
        } catch (ProviderUnavailableException e) {
            LOG.debug("position unavailable body={} at={} err={}", subEvent.body().code(), instant, e.getMessage());
            return;
        }
        if (!subEvent.matchesAzimuth(position.azimuth)) {
            return;
        }
        double azimuthDiff = GeoAstronomy.azimuthDifference(position.azimuth, location.fujiBearing);
        for (int i = 0; i < variants.size(); i++) {
            if (onlyVariant >= 0 && i != onlyVariant) {
                continue;
            }
            TargetVariant variant = variants.get(i);
            double target = variant.targetElevation(location.fujiElevation, subEvent.body());
            double elevationDiff = Math.abs(position.elevation - target);
            double score = azimuthDiff * 2.0 + elevationDiff;
            if (best[i] != null && best[i].score() <= score) {
                continue;
            }
            best[i] = new AlignmentMatch(
                    subEvent,
                    variant,
                    instant,
                    position.azimuth,
                    position.elevation,
                    target,
                    azimuthDiff,
                    elevationDiff,
                    score,
                    position.moonPhase,
                    position.illuminatedFraction
            );
        }
    }
}
