package com.fujical.engine.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FujiEventRow {
    private long locationId;
    private int year;
    private LocalDate eventDate;
    private OffsetDateTime eventTime;
    private String phenomenonType;
    private double azimuth;
    private double elevation;
    private double azimuthDiff;
    private double elevationDiff;
    private double totalDiff;
    private String accuracyTier;
    private double qualityScore;
    private Double moonPhase;
    private Double moonIllumination;
}
