package com.fujical.engine.stage;

import com.fujical.engine.config.Config;
import com.fujical.engine.geo.GeoAstronomy;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.DayPart;
import com.fujical.engine.model.FujiCandidateWindow;
import com.fujical.engine.model.OrbitSnapshot;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.search.QualityModel;
import com.fujical.engine.store.CandidateStore;
import com.fujical.engine.store.OrbitSnapshotStore;

import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Stage 2: narrows the year's snapshots to one plausible sample per date, phenomenon and day part.
 */
public final class CandidateFilter {
    private final OrbitSnapshotStore snapshotStore;
    private final CandidateStore candidateStore;
    private final QualityModel qualityModel;
    private final ZoneId zone;
    private final double risingCenter;
    private final double risingHalfWidth;
    private final double settingCenter;
    private final double settingHalfWidth;
    private final double elevationMin;
    private final double elevationMax;
    private final int morningStartHour;
    private final int morningEndHour;
    private final int afternoonStartHour;
    private final int afternoonEndHour;
    private final double moonMinIllumination;
    private final int batchSize;

    public CandidateFilter(Config config, OrbitSnapshotStore snapshotStore, CandidateStore candidateStore) {
        this.snapshotStore = snapshotStore;
        this.candidateStore = candidateStore;
        this.qualityModel = new QualityModel(config);
        this.zone = config.zone();
        this.risingCenter = config.getDouble("stage2.rising.azimuth_center", 95.0);
        this.risingHalfWidth = config.getDouble("stage2.rising.azimuth_half_width", 35.0);
        this.settingCenter = config.getDouble("stage2.setting.azimuth_center", 265.0);
        this.settingHalfWidth = config.getDouble("stage2.setting.azimuth_half_width", 30.0);
        this.elevationMin = config.getDouble("stage2.elevation_min", -10.0);
        this.elevationMax = config.getDouble("stage2.elevation_max", 90.0);
        this.morningStartHour = config.getInt("stage2.sun.morning_start_hour", 4);
        this.morningEndHour = config.getInt("stage2.sun.morning_end_hour", 9);
        this.afternoonStartHour = config.getInt("stage2.sun.afternoon_start_hour", 14);
        this.afternoonEndHour = config.getInt("stage2.sun.afternoon_end_hour", 19);
        this.moonMinIllumination = config.getDouble("stage2.moon.min_illumination", 0.70);
        this.batchSize = Math.max(1, config.getInt("stage2.batch_size", 1000));
    }

    public Summary filter(int year) throws SQLException {
        long started = System.currentTimeMillis();
        candidateStore.deleteYear(year);

        List<OrbitSnapshot> source = new ArrayList<>();
        for (CelestialBody body : CelestialBody.values()) {
            Double minIllumination = body == CelestialBody.MOON ? moonMinIllumination : null;
            for (double[] band : List.of(
                    new double[]{risingCenter, risingHalfWidth},
                    new double[]{settingCenter, settingHalfWidth})) {
                for (AzimuthRange range : AzimuthRange.around(band[0], band[1])) {
                    source.addAll(snapshotStore.findInBand(
                            year, body, range.min(), range.max(), elevationMin, elevationMax, minIllumination));
                }
            }
        }

        List<FujiCandidateWindow> candidates = selectCandidates(year, source);
        int written = 0;
        for (int from = 0; from < candidates.size(); from += batchSize) {
            int to = Math.min(candidates.size(), from + batchSize);
            written += candidateStore.insertBatch(candidates.subList(from, to));
        }
        System.out.println(String.format(
                Locale.US,
                "Stage2 done year=%d scanned=%d candidates=%d elapsed_ms=%d",
                year,
                source.size(),
                written,
                System.currentTimeMillis() - started
        ));
        return new Summary(year, source.size(), written);
    }

    /**
     * Applies the band, hour and illumination filters and keeps, per (date, phenomenon, day part),
     * the sample closest in azimuth to the band centre. Result is ordered by instant.
     */
    public List<FujiCandidateWindow> selectCandidates(int year, List<OrbitSnapshot> snapshots) {
        Map<String, Pick> best = new LinkedHashMap<>();
        for (OrbitSnapshot s : snapshots) {
            if (s == null || s.year != year) {
                continue;
            }
            if (!Double.isFinite(s.azimuth) || s.elevation < elevationMin || s.elevation > elevationMax) {
                continue;
            }
            double risingOffset = GeoAstronomy.azimuthDifference(s.azimuth, risingCenter);
            double settingOffset = GeoAstronomy.azimuthDifference(s.azimuth, settingCenter);
            boolean rising;
            double offset;
            if (risingOffset <= risingHalfWidth) {
                rising = true;
                offset = risingOffset;
            } else if (settingOffset <= settingHalfWidth) {
                rising = false;
                offset = settingOffset;
            } else {
                continue;
            }

            ZonedDateTime local = s.instant.atZone(zone);
            int hour = local.getHour();
            if (s.body == CelestialBody.SUN) {
                boolean morning = hour >= morningStartHour && hour <= morningEndHour;
                boolean afternoon = hour >= afternoonStartHour && hour <= afternoonEndHour;
                if (!morning && !afternoon) {
                    continue;
                }
            } else if (s.moonIllumination == null || s.moonIllumination < moonMinIllumination) {
                continue;
            }

            PhenomenonType type = PhenomenonType.of(s.body, rising);
            DayPart dayPart = DayPart.ofHour(hour);
            LocalDate date = local.toLocalDate();
            String key = date + "|" + type.code() + "|" + dayPart.code();
            Pick current = best.get(key);
            if (current == null
                    || offset < current.offset
                    || (offset == current.offset && s.instant.isBefore(current.snapshot.instant))) {
                best.put(key, new Pick(s, type, dayPart, date, offset, qualityModel.atmosphericFactor(local)));
            }
        }

        List<FujiCandidateWindow> out = new ArrayList<>(best.size());
        for (Pick pick : best.values()) {
            OrbitSnapshot s = pick.snapshot;
            out.add(new FujiCandidateWindow(
                    year,
                    pick.date,
                    s.instant,
                    s.body,
                    pick.type,
                    pick.dayPart,
                    s.azimuth,
                    s.elevation,
                    s.moonPhase,
                    s.moonIllumination,
                    pick.atmosphericFactor
            ));
        }
        out.sort(Comparator.comparing((FujiCandidateWindow c) -> c.instant).thenComparing(c -> c.phenomenonType));
        return out;
    }

    public record Summary(int year, int snapshotsScanned, int candidatesWritten) {
    }

    private static final class Pick {
        final OrbitSnapshot snapshot;
        final PhenomenonType type;
        final DayPart dayPart;
        final LocalDate date;
        final double offset;
        final double atmosphericFactor;

        private Pick(OrbitSnapshot snapshot, PhenomenonType type, DayPart dayPart, LocalDate date, double offset, double atmosphericFactor) {
            this.snapshot = Objects.requireNonNull(snapshot);
            this.type = type;
            this.dayPart = dayPart;
            this.date = date;
            this.offset = offset;
            this.atmosphericFactor = atmosphericFactor;
        }
    }
}
