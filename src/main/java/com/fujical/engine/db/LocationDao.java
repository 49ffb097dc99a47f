package com.fujical.engine.db;

import com.fujical.engine.db.mybatis.LocationMapper;
import com.fujical.engine.db.mybatis.LocationRow;
import com.fujical.engine.db.mybatis.MyBatisSupport;
import com.fujical.engine.geo.InvalidCoordinatesException;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.store.LocationStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads registered locations. Fuji geometry is recomputed from the stored coordinates;
 * rows with invalid coordinates are reported and left out.
 */
public final class LocationDao implements LocationStore {
    private final Database database;

    public LocationDao(Database database) {
        this.database = database;
    }

    @Override
    public List<ObserverLocation> findAll() throws SQLException {
        List<LocationRow> rows;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            rows = session.getMapper(LocationMapper.class).selectAll();
        }
        List<ObserverLocation> out = new ArrayList<>(rows.size());
        for (LocationRow row : rows) {
            try {
                out.add(toLocation(row));
            } catch (InvalidCoordinatesException e) {
                System.err.println("WARN: skip location id=" + row.getId() + ", err=" + e.getMessage());
            }
        }
        return out;
    }

    @Override
    public Optional<ObserverLocation> findById(long id) throws SQLException {
        LocationRow row;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            row = session.getMapper(LocationMapper.class).selectById(id);
        }
        return row == null ? Optional.empty() : Optional.of(toLocation(row));
    }

    private ObserverLocation toLocation(LocationRow row) {
        return ObserverLocation.of(row.getId(), row.getName(), row.getLatitude(), row.getLongitude(), row.getElevation());
    }
}
