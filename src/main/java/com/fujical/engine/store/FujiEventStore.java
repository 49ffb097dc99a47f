package com.fujical.engine.store;

import com.fujical.engine.model.EventStatistics;
import com.fujical.engine.model.FujiEvent;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;

public interface FujiEventStore {
    int deleteYear(int year) throws SQLException;

    int deleteLocationYear(long locationId, int year) throws SQLException;

    int insertBatch(List<FujiEvent> events) throws SQLException;

    long countYear(int year) throws SQLException;

    long countLocationYear(long locationId, int year) throws SQLException;

    int countLocationsWithEvents(int year) throws SQLException;

    List<FujiEvent> findByLocationAndDate(long locationId, LocalDate date) throws SQLException;

    EventStatistics statistics(int year) throws SQLException;
}
