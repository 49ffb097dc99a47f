package com.fujical.engine.db;

import com.fujical.engine.db.mybatis.MyBatisSupport;
import com.fujical.engine.db.mybatis.OrbitSnapshotMapper;
import com.fujical.engine.db.mybatis.OrbitSnapshotRow;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.OrbitSnapshot;
import com.fujical.engine.store.OrbitSnapshotStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class OrbitSnapshotDao implements OrbitSnapshotStore {
    private final Database database;

    public OrbitSnapshotDao(Database database) {
        this.database = database;
    }

    @Override
    public int deleteYear(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(OrbitSnapshotMapper.class).deleteYear(year);
            conn.commit();
            return n;
        }
    }

    @Override
    public int deleteRange(int year, Instant from, Instant to) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(OrbitSnapshotMapper.class)
                    .deleteRange(year, OffsetDateTime.ofInstant(from, ZoneOffset.UTC), OffsetDateTime.ofInstant(to, ZoneOffset.UTC));
            conn.commit();
            return n;
        }
    }

    @Override
    public int insertBatch(List<OrbitSnapshot> snapshots) throws SQLException {
        if (snapshots == null || snapshots.isEmpty()) {
            return 0;
        }
        List<OrbitSnapshotRow> rows = new ArrayList<>(snapshots.size());
        for (OrbitSnapshot s : snapshots) {
            rows.add(OrbitSnapshotRow.builder()
                    .year(s.year)
                    .observedAt(OffsetDateTime.ofInstant(s.instant, ZoneOffset.UTC))
                    .body(s.body.code())
                    .azimuth(s.azimuth)
                    .elevation(s.elevation)
                    .visible(s.visible)
                    .moonPhase(s.moonPhase)
                    .moonIllumination(s.moonIllumination)
                    .build());
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(OrbitSnapshotMapper.class).insertBatch(rows);
            conn.commit();
            return n;
        }
    }

    @Override
    public long countYear(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(OrbitSnapshotMapper.class).countYear(year);
        }
    }

    @Override
    public List<OrbitSnapshot> findInBand(
            int year,
            CelestialBody body,
            double azimuthMin,
            double azimuthMax,
            double elevationMin,
            double elevationMax,
            Double minIllumination
    ) throws SQLException {
        Double illumination = body == CelestialBody.MOON ? minIllumination : null;
        List<OrbitSnapshotRow> rows;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            rows = session.getMapper(OrbitSnapshotMapper.class)
                    .selectInBand(year, body.code(), azimuthMin, azimuthMax, elevationMin, elevationMax, illumination);
        }
        List<OrbitSnapshot> out = new ArrayList<>(rows.size());
        for (OrbitSnapshotRow row : rows) {
            out.add(new OrbitSnapshot(
                    row.getYear(),
                    row.getObservedAt().toInstant(),
                    CelestialBody.fromCode(row.getBody()),
                    row.getAzimuth(),
                    row.getElevation(),
                    row.isVisible(),
                    row.getMoonPhase(),
                    row.getMoonIllumination()
            ));
        }
        return out;
    }
}
