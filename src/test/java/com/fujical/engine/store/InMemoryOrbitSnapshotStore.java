package com.fujical.engine.store;

import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.OrbitSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryOrbitSnapshotStore implements OrbitSnapshotStore {
    private final Map<String, OrbitSnapshot> rows = new LinkedHashMap<>();
    public int insertCalls;

    @Override
    public synchronized int deleteYear(int year) {
        int before = rows.size();
        rows.values().removeIf(s -> s.year == year);
        return before - rows.size();
    }

    @Override
    public synchronized int deleteRange(int year, Instant from, Instant to) {
        int before = rows.size();
        rows.values().removeIf(s -> s.year == year && !s.instant.isBefore(from) && s.instant.isBefore(to));
        return before - rows.size();
    }

    @Override
    public synchronized int insertBatch(List<OrbitSnapshot> snapshots) {
        insertCalls++;
        for (OrbitSnapshot s : snapshots) {
            rows.put(s.instant + "|" + s.body, s);
        }
        return snapshots.size();
    }

    @Override
    public synchronized long countYear(int year) {
        return rows.values().stream().filter(s -> s.year == year).count();
    }

    @Override
    public synchronized List<OrbitSnapshot> findInBand(
            int year,
            CelestialBody body,
            double azimuthMin,
            double azimuthMax,
            double elevationMin,
            double elevationMax,
            Double minIllumination
    ) {
        List<OrbitSnapshot> out = new ArrayList<>();
        for (OrbitSnapshot s : rows.values()) {
            if (s.year != year || s.body != body) {
                continue;
            }
            if (s.azimuth < azimuthMin || s.azimuth > azimuthMax || s.elevation < elevationMin || s.elevation > elevationMax) {
                continue;
            }
            if (body == CelestialBody.MOON && minIllumination != null
                    && (s.moonIllumination == null || s.moonIllumination < minIllumination)) {
                continue;
            }
            out.add(s);
        }
        out.sort(Comparator.comparing(s -> s.instant));
        return out;
    }

    public synchronized List<OrbitSnapshot> all() {
        return new ArrayList<>(rows.values());
    }
}
