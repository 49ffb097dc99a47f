package com.fujical.engine.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.OffsetDateTime;

public interface PipelineStateMapper {
    @Select("SELECT state_value FROM pipeline_state WHERE state_key = #{key}")
    String selectState(@Param("key") String key);

    @Insert("INSERT INTO pipeline_state(state_key, state_value, updated_at) VALUES(#{key}, #{value}, #{updatedAt}) " +
            "ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value, updated_at=excluded.updated_at")
    int upsertState(
            @Param("key") String key,
            @Param("value") String value,
            @Param("updatedAt") OffsetDateTime updatedAt
    );

    @Delete("DELETE FROM pipeline_state WHERE state_key = #{key}")
    int deleteState(@Param("key") String key);
}
