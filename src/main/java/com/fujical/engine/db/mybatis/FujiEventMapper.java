package com.fujical.engine.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface FujiEventMapper {
    @Delete("DELETE FROM fuji_events WHERE year = #{year}")
    int deleteYear(@Param("year") int year);

    @Delete("DELETE FROM fuji_events WHERE year = #{year} AND location_id = #{locationId}")
    int deleteLocationYear(@Param("locationId") long locationId, @Param("year") int year);

    @Insert({
            "<script>",
            "INSERT INTO fuji_events(location_id, year, event_date, event_time, phenomenon_type, azimuth, elevation, ",
            "azimuth_diff, elevation_diff, total_diff, accuracy_tier, quality_score, moon_phase, moon_illumination) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.locationId}, #{r.year}, #{r.eventDate}, #{r.eventTime}, #{r.phenomenonType}, #{r.azimuth}, #{r.elevation}, ",
            "#{r.azimuthDiff}, #{r.elevationDiff}, #{r.totalDiff}, #{r.accuracyTier}, #{r.qualityScore}, ",
            "#{r.moonPhase}, #{r.moonIllumination})",
            "</foreach>",
            "ON CONFLICT(location_id, event_date, event_time, phenomenon_type) DO NOTHING",
            "</script>"
    })
    int insertBatch(@Param("rows") List<FujiEventRow> rows);

    @Select("SELECT COUNT(*) FROM fuji_events WHERE year = #{year}")
    long countYear(@Param("year") int year);

    @Select("SELECT COUNT(*) FROM fuji_events WHERE location_id = #{locationId} AND year = #{year}")
    long countLocationYear(@Param("locationId") long locationId, @Param("year") int year);

    @Select("SELECT COUNT(DISTINCT location_id) FROM fuji_events WHERE year = #{year}")
    int countLocationsWithEvents(@Param("year") int year);

    @Select("SELECT location_id, year, event_date, event_time, phenomenon_type, azimuth, elevation, azimuth_diff, " +
            "elevation_diff, total_diff, accuracy_tier, quality_score, moon_phase, moon_illumination " +
            "FROM fuji_events WHERE location_id = #{locationId} AND event_date = #{date} ORDER BY event_time")
    List<FujiEventRow> selectByLocationAndDate(@Param("locationId") long locationId, @Param("date") LocalDate date);

    @Select("SELECT phenomenon_type AS group_key, COUNT(*) AS n FROM fuji_events WHERE year = #{year} " +
            "GROUP BY phenomenon_type")
    List<GroupCountRow> countByPhenomenon(@Param("year") int year);

    @Select("SELECT accuracy_tier AS group_key, COUNT(*) AS n FROM fuji_events WHERE year = #{year} " +
            "GROUP BY accuracy_tier")
    List<GroupCountRow> countByTier(@Param("year") int year);
}
