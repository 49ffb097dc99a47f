package com.fujical.engine.db;

import com.fujical.engine.db.mybatis.PipelineStateMapper;
import com.fujical.engine.db.mybatis.MyBatisSupport;
import com.fujical.engine.store.CheckpointStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Stage checkpoints and the schema version, one {@code pipeline_state} row per key.
 */
public final class PipelineStateDao implements CheckpointStore {
    private final Database database;

    public PipelineStateDao(Database database) {
        this.database = database;
    }

    @Override
    public Optional<String> get(String key) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(PipelineStateMapper.class).selectState(key));
        }
    }

    @Override
    public void put(String key, String value) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(PipelineStateMapper.class).upsertState(key, value, OffsetDateTime.now(ZoneOffset.UTC));
            conn.commit();
        }
    }

    @Override
    public void delete(String key) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(PipelineStateMapper.class).deleteState(key);
            conn.commit();
        }
    }
}
