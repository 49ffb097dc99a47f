package com.fujical.engine.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the schema, the location and pipeline tables and their band indexes.
 * Every statement is guarded so a rerun against an existing schema is a no-op.
 */
public final class MigrationRunner {
    static final int TARGET_VERSION = 1;
    static final String SCHEMA_VERSION_KEY = "schema.version";

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS pipeline_state (" +
                    "state_key TEXT PRIMARY KEY," +
                    "state_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";

            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String summary = summarizeSql(lastSql);
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summary
                        + ", cause=" + safe(e.getMessage());
                System.err.println("ERROR: " + detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS locations (" +
                "id BIGINT PRIMARY KEY," +
                "name TEXT NOT NULL," +
                "latitude DOUBLE PRECISION NOT NULL," +
                "longitude DOUBLE PRECISION NOT NULL," +
                "elevation DOUBLE PRECISION NOT NULL DEFAULT 0," +
                "fuji_bearing DOUBLE PRECISION NULL," +
                "fuji_elevation DOUBLE PRECISION NULL," +
                "fuji_distance DOUBLE PRECISION NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS orbit_snapshots (" +
                "id BIGSERIAL PRIMARY KEY," +
                "year INTEGER NOT NULL," +
                "observed_at TIMESTAMPTZ NOT NULL," +
                "body TEXT NOT NULL," +
                "azimuth DOUBLE PRECISION NOT NULL," +
                "elevation DOUBLE PRECISION NOT NULL," +
                "visible BOOLEAN NOT NULL," +
                "moon_phase DOUBLE PRECISION NULL," +
                "moon_illumination DOUBLE PRECISION NULL," +
                "UNIQUE (observed_at, body)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS fuji_candidates (" +
                "id BIGSERIAL PRIMARY KEY," +
                "year INTEGER NOT NULL," +
                "event_date DATE NOT NULL," +
                "observed_at TIMESTAMPTZ NOT NULL," +
                "body TEXT NOT NULL," +
                "phenomenon_type TEXT NOT NULL," +
                "day_part TEXT NOT NULL," +
                "azimuth DOUBLE PRECISION NOT NULL," +
                "elevation DOUBLE PRECISION NOT NULL," +
                "moon_phase DOUBLE PRECISION NULL," +
                "moon_illumination DOUBLE PRECISION NULL," +
                "atmospheric_factor DOUBLE PRECISION NOT NULL," +
                "UNIQUE (event_date, phenomenon_type, day_part)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS fuji_events (" +
                "id BIGSERIAL PRIMARY KEY," +
                "location_id BIGINT NOT NULL," +
                "year INTEGER NOT NULL," +
                "event_date DATE NOT NULL," +
                "event_time TIMESTAMPTZ NOT NULL," +
                "phenomenon_type TEXT NOT NULL," +
                "azimuth DOUBLE PRECISION NOT NULL," +
                "elevation DOUBLE PRECISION NOT NULL," +
                "azimuth_diff DOUBLE PRECISION NOT NULL," +
                "elevation_diff DOUBLE PRECISION NOT NULL," +
                "total_diff DOUBLE PRECISION NOT NULL," +
                "accuracy_tier TEXT NOT NULL," +
                "quality_score DOUBLE PRECISION NOT NULL," +
                "moon_phase DOUBLE PRECISION NULL," +
                "moon_illumination DOUBLE PRECISION NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (location_id, event_date, event_time, phenomenon_type)" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_orbit_snapshots_band ON orbit_snapshots(year, body, azimuth, elevation)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_orbit_snapshots_year_at ON orbit_snapshots(year, observed_at)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_fuji_candidates_band ON fuji_candidates(year, body, azimuth, elevation)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_fuji_events_location_date ON fuji_events(location_id, event_date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_fuji_events_year ON fuji_events(year, location_id)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT state_value FROM pipeline_state WHERE state_key='" + SCHEMA_VERSION_KEY + "'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            return 0;
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO pipeline_state(state_key, state_value, updated_at) VALUES(?, ?, now()) " +
                        "ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, SCHEMA_VERSION_KEY);
            ps.setString(2, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
