package com.fujical.engine.db;

import com.fujical.engine.db.mybatis.FujiEventMapper;
import com.fujical.engine.db.mybatis.FujiEventRow;
import com.fujical.engine.db.mybatis.GroupCountRow;
import com.fujical.engine.db.mybatis.MyBatisSupport;
import com.fujical.engine.model.AccuracyTier;
import com.fujical.engine.model.EventStatistics;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.PhenomenonType;
import com.fujical.engine.store.FujiEventStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class FujiEventDao implements FujiEventStore {
    private final Database database;

    public FujiEventDao(Database database) {
        this.database = database;
    }

    @Override
    public int deleteYear(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(FujiEventMapper.class).deleteYear(year);
            conn.commit();
            return n;
        }
    }

    @Override
    public int deleteLocationYear(long locationId, int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(FujiEventMapper.class).deleteLocationYear(locationId, year);
            conn.commit();
            return n;
        }
    }

    @Override
    public int insertBatch(List<FujiEvent> events) throws SQLException {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        List<FujiEventRow> rows = new ArrayList<>(events.size());
        for (FujiEvent e : events) {
            rows.add(FujiEventRow.builder()
                    .locationId(e.locationId)
                    .year(e.year())
                    .eventDate(e.date)
                    .eventTime(OffsetDateTime.ofInstant(e.instant, ZoneOffset.UTC))
                    .phenomenonType(e.phenomenonType.code())
                    .azimuth(e.azimuth)
                    .elevation(e.elevation)
                    .azimuthDiff(e.azimuthDiff)
                    .elevationDiff(e.elevationDiff)
                    .totalDiff(e.totalDiff)
                    .accuracyTier(e.accuracyTier.code())
                    .qualityScore(e.qualityScore)
                    .moonPhase(e.moonPhase)
                    .moonIllumination(e.moonIllumination)
                    .build());
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(FujiEventMapper.class).insertBatch(rows);
            conn.commit();
            return n;
        }
    }

    @Override
    public long countYear(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(FujiEventMapper.class).countYear(year);
        }
    }

    @Override
    public long countLocationYear(long locationId, int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(FujiEventMapper.class).countLocationYear(locationId, year);
        }
    }

    @Override
    public int countLocationsWithEvents(int year) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(FujiEventMapper.class).countLocationsWithEvents(year);
        }
    }

    @Override
    public List<FujiEvent> findByLocationAndDate(long locationId, LocalDate date) throws SQLException {
        List<FujiEventRow> rows;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            rows = session.getMapper(FujiEventMapper.class).selectByLocationAndDate(locationId, date);
        }
        List<FujiEvent> out = new ArrayList<>(rows.size());
        for (FujiEventRow row : rows) {
            out.add(new FujiEvent(
                    row.getLocationId(),
                    row.getEventDate(),
                    row.getEventTime().toInstant(),
                    PhenomenonType.fromCode(row.getPhenomenonType()),
                    row.getAzimuth(),
                    row.getElevation(),
                    row.getAzimuthDiff(),
                    row.getElevationDiff(),
                    row.getQualityScore(),
                    row.getMoonPhase(),
                    row.getMoonIllumination()
            ));
        }
        return out;
    }

    @Override
    public EventStatistics statistics(int year) throws SQLException {
        Map<PhenomenonType, Long> byPhenomenon = new EnumMap<>(PhenomenonType.class);
        Map<AccuracyTier, Long> byTier = new EnumMap<>(AccuracyTier.class);
        long total;
        int locations;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            FujiEventMapper mapper = session.getMapper(FujiEventMapper.class);
            for (GroupCountRow row : mapper.countByPhenomenon(year)) {
                byPhenomenon.merge(PhenomenonType.fromCode(row.getGroupKey()), row.getN(), Long::sum);
            }
            for (GroupCountRow row : mapper.countByTier(year)) {
                byTier.merge(AccuracyTier.fromCode(row.getGroupKey()), row.getN(), Long::sum);
            }
            total = mapper.countYear(year);
            locations = mapper.countLocationsWithEvents(year);
        }
        return new EventStatistics(year, total, byPhenomenon, byTier, locations);
    }
}
