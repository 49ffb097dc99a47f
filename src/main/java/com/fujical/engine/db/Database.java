package com.fujical.engine.db;

import com.fujical.engine.store.StoreHealth;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Database connection manager backed by PostgreSQL.
 */
public final class Database implements StoreHealth {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must use PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);
        if (sqlLogEnabled) {
            Configurator.setLevel(SQL_LOG.getName(), Level.DEBUG);
        }

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(this.schema);
        pg.setApplicationName("fujical");
        this.dataSource = pg;
    }

    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                st.execute("SET search_path TO " + schema + ", public");
            }
            SQL_LOG.debug("connected schema={} url={}", schema, maskedJdbcUrl());
            return raw;
        } catch (SQLException e) {
            String cwd = Paths.get(".").toAbsolutePath().normalize().toString();
            String hint = classifyConnectFailure(e);
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", cwd=" + cwd
                    + ", hint=" + hint
                    + ", cause=" + safe(e.getMessage());
            System.err.println(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    @Override
    public void ping() throws SQLException {
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute("SELECT 1");
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "fujical" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("connection attempt failed")) {
            return "unreachable";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
