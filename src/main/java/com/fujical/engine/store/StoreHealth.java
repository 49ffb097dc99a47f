package com.fujical.engine.store;

import java.sql.SQLException;

/**
 * Connectivity check for the backing store.
 */
public interface StoreHealth {
    void ping() throws SQLException;
}
