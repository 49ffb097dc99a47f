package com.fujical.engine.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.OffsetDateTime;
import java.util.List;

public interface OrbitSnapshotMapper {
    @Delete("DELETE FROM orbit_snapshots WHERE year = #{year}")
    int deleteYear(@Param("year") int year);

    @Delete("DELETE FROM orbit_snapshots WHERE year = #{year} AND observed_at >= #{from} AND observed_at < #{to}")
    int deleteRange(
            @Param("year") int year,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to
    );

    @Insert({
            "<script>",
            "INSERT INTO orbit_snapshots(year, observed_at, body, azimuth, elevation, visible, moon_phase, moon_illumination) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.year}, #{r.observedAt}, #{r.body}, #{r.azimuth}, #{r.elevation}, #{r.visible}, #{r.moonPhase}, #{r.moonIllumination})",
            "</foreach>",
            "ON CONFLICT(observed_at, body) DO UPDATE SET azimuth=excluded.azimuth, elevation=excluded.elevation, ",
            "visible=excluded.visible, moon_phase=excluded.moon_phase, moon_illumination=excluded.moon_illumination",
            "</script>"
    })
    int insertBatch(@Param("rows") List<OrbitSnapshotRow> rows);

    @Select("SELECT COUNT(*) FROM orbit_snapshots WHERE year = #{year}")
    long countYear(@Param("year") int year);

    @Select({
            "<script>",
            "SELECT year, observed_at, body, azimuth, elevation, visible, moon_phase, moon_illumination",
            "FROM orbit_snapshots",
            "WHERE year = #{year} AND body = #{body}",
            "AND azimuth &gt;= #{azimuthMin} AND azimuth &lt;= #{azimuthMax}",
            "AND elevation &gt;= #{elevationMin} AND elevation &lt;= #{elevationMax}",
            "<if test='minIllumination != null'>AND moon_illumination &gt;= #{minIllumination}</if>",
            "ORDER BY observed_at",
            "</script>"
    })
    List<OrbitSnapshotRow> selectInBand(
            @Param("year") int year,
            @Param("body") String body,
            @Param("azimuthMin") double azimuthMin,
            @Param("azimuthMax") double azimuthMax,
            @Param("elevationMin") double elevationMin,
            @Param("elevationMax") double elevationMax,
            @Param("minIllumination") Double minIllumination
    );
}
