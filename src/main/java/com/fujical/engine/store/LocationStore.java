package com.fujical.engine.store;

import com.fujical.engine.model.ObserverLocation;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public interface LocationStore {
    List<ObserverLocation> findAll() throws SQLException;

    Optional<ObserverLocation> findById(long id) throws SQLException;
}
