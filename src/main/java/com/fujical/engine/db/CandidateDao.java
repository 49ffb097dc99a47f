package com.fujical.engine.db;

import com.fujical.engine.db.mybatis.CandidateMapper;
import com.fujical.engine.db.mybatis.CandidateRow;
import com.fujical.engine.db.mybatis.MyBatisSupport;
import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.DayPart;
import com.fujical.engine.model.FujiCandidateWindow;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.store.CandidateStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class CandidateDao implements CandidateStore {
    private final Database database;

    public CandidateDao(Database database) {
        this.database = database;
    }

    @Override
    public int deleteYear(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(CandidateMapper.class).deleteYear(year);
            conn.commit();
            return n;
        }
    }

    @Override
    public int insertBatch(List<FujiCandidateWindow> candidates) throws SQLException {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        List<CandidateRow> rows = new ArrayList<>(candidates.size());
        for (FujiCandidateWindow c : candidates) {
            rows.add(CandidateRow.builder()
                    .year(c.year)
                    .eventDate(c.date)
                    .observedAt(OffsetDateTime.ofInstant(c.instant, ZoneOffset.UTC))
                    .body(c.body.code())
                    .phenomenonType(c.phenomenonType.code())
                    .dayPart(c.dayPart.code())
                    .azimuth(c.azimuth)
                    .elevation(c.elevation)
                    .moonPhase(c.moonPhase)
                    .moonIllumination(c.moonIllumination)
                    .atmosphericFactor(c.atmosphericFactor)
                    .build());
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(CandidateMapper.class).insertBatch(rows);
            conn.commit();
            return n;
        }
    }

    @Override
    public long countYear(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(CandidateMapper.class).countYear(year);
        }
    }

    @Override
    public List<FujiCandidateWindow> findInBand(
            int year,
            CelestialBody body,
            double azimuthMin,
            double azimuthMax,
            double elevationMin,
            double elevationMax
    ) throws SQLException {
        List<CandidateRow> rows;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            rows = session.getMapper(CandidateMapper.class)
                    .selectInBand(year, body.code(), azimuthMin, azimuthMax, elevationMin, elevationMax);
        }
        List<FujiCandidateWindow> out = new ArrayList<>(rows.size());
        for (CandidateRow row : rows) {
            out.add(new FujiCandidateWindow(
                    row.getYear(),
                    row.getEventDate(),
                    row.getObservedAt().toInstant(),
                    CelestialBody.fromCode(row.getBody()),
                    PhenomenonType.fromCode(row.getPhenomenonType()),
                    DayPart.fromCode(row.getDayPart()),
                    row.getAzimuth(),
                    row.getElevation(),
                    row.getMoonPhase(),
                    row.getMoonIllumination(),
                    row.getAtmosphericFactor()
            ));
        }
        return out;
    }
}
