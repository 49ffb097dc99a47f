package com.fujical.engine.store;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Key/value documents used for resumable runs.
 */
public interface CheckpointStore {
    Optional<String> get(String key) throws SQLException;

    void put(String key, String value) throws SQLException;

    void delete(String key) throws SQLException;
}
