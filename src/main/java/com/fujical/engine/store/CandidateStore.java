package com.fujical.engine.store;

import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.FujiCandidateWindow;

import java.sql.SQLException;
import java.util.List;

/**
 * Stage-2 candidate windows, keyed by year.
 */
public interface CandidateStore {
    int deleteYear(int year) throws SQLException;

    int insertBatch(List<FujiCandidateWindow> candidates) throws SQLException;

    long countYear(int year) throws SQLException;

    /**
     * Candidates of one body inside an azimuth/elevation box, ordered by instant.
     */
    List<FujiCandidateWindow> findInBand(
            int year,
            CelestialBody body,
            double azimuthMin,
            double azimuthMax,
            double elevationMin,
            double elevationMax
    ) throws SQLException;
}
