package com.fujical.engine.store;

import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.OrbitSnapshot;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Stage-1 orbit snapshots, keyed by year.
 */
public interface OrbitSnapshotStore {
    int deleteYear(int year) throws SQLException;

    /**
     * Deletes snapshots of the year with instant in [from, to).
     */
    int deleteRange(int year, Instant from, Instant to) throws SQLException;

    int insertBatch(List<OrbitSnapshot> snapshots) throws SQLException;

    long countYear(int year) throws SQLException;

    /**
     * Snapshots of one body inside an azimuth/elevation box, ordered by instant.
     * {@code minIllumination} is ignored when null or for the sun.
     */
    List<OrbitSnapshot> findInBand(
            int year,
            CelestialBody body,
            double azimuthMin,
            double azimuthMax,
            double elevationMin,
            double elevationMax,
            Double minIllumination
    ) throws SQLException;

}
