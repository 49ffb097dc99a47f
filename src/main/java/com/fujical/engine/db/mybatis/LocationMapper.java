package com.fujical.engine.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface LocationMapper {
    @Select("SELECT id, name, latitude, longitude, elevation FROM locations ORDER BY id")
    List<LocationRow> selectAll();

    @Select("SELECT id, name, latitude, longitude, elevation FROM locations WHERE id = #{id}")
    LocationRow selectById(@Param("id") long id);
}
