package com.fujical.app;

import com.fujical.app.properties.DbProperties;
import com.fujical.engine.db.Database;

/**
 * Database settings resolved from the environment first, then configuration.
 */
final class DbSettings {
    static final String ENV_URL = "FUJICAL_DB_URL";
    static final String ENV_USER = "FUJICAL_DB_USER";
    static final String ENV_PASS = "FUJICAL_DB_PASS";

    final String url;
    final String user;
    final String pass;
    final String schema;
    final boolean sqlLogEnabled;

    DbSettings(String url, String user, String pass, String schema, boolean sqlLogEnabled) {
        this.url = url;
        this.user = user;
        this.pass = pass;
        this.schema = schema;
        this.sqlLogEnabled = sqlLogEnabled;
    }

    static DbSettings fromProperties(DbProperties properties) {
        boolean sqlLog = properties.getSqlLog() != null && properties.getSqlLog().isEnabled();
        return new DbSettings(
                firstNonBlank(System.getenv(ENV_URL), properties.getUrl()),
                firstNonBlank(System.getenv(ENV_USER), properties.getUser()),
                firstNonBlank(System.getenv(ENV_PASS), properties.getPass()),
                firstNonBlank(properties.getSchema(), "fujical"),
                sqlLog
        );
    }

    Database open() {
        return new Database(url, user, pass, schema, sqlLogEnabled);
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
