package com.fujical.engine.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface CandidateMapper {
    @Delete("DELETE FROM fuji_candidates WHERE year = #{year}")
    int deleteYear(@Param("year") int year);

    @Insert({
            "<script>",
            "INSERT INTO fuji_candidates(year, event_date, observed_at, body, phenomenon_type, day_part, azimuth, elevation, ",
            "moon_phase, moon_illumination, atmospheric_factor) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.year}, #{r.eventDate}, #{r.observedAt}, #{r.body}, #{r.phenomenonType}, #{r.dayPart}, #{r.azimuth}, ",
            "#{r.elevation}, #{r.moonPhase}, #{r.moonIllumination}, #{r.atmosphericFactor})",
            "</foreach>",
            "ON CONFLICT(event_date, phenomenon_type, day_part) DO UPDATE SET observed_at=excluded.observed_at, ",
            "azimuth=excluded.azimuth, elevation=excluded.elevation, moon_phase=excluded.moon_phase, ",
            "moon_illumination=excluded.moon_illumination, atmospheric_factor=excluded.atmospheric_factor",
            "</script>"
    })
    int insertBatch(@Param("rows") List<CandidateRow> rows);

    @Select("SELECT COUNT(*) FROM fuji_candidates WHERE year = #{year}")
    long countYear(@Param("year") int year);

    @Select("SELECT year, event_date, observed_at, body, phenomenon_type, day_part, azimuth, elevation, " +
            "moon_phase, moon_illumination, atmospheric_factor FROM fuji_candidates " +
            "WHERE year = #{year} AND body = #{body} " +
            "AND azimuth >= #{azimuthMin} AND azimuth <= #{azimuthMax} " +
            "AND elevation >= #{elevationMin} AND elevation <= #{elevationMax} " +
            "ORDER BY observed_at")
    List<CandidateRow> selectInBand(
            @Param("year") int year,
            @Param("body") String body,
            @Param("azimuthMin") double azimuthMin,
            @Param("azimuthMax") double azimuthMax,
            @Param("elevationMin") double elevationMin,
            @Param("elevationMax") double elevationMax
    );
}
