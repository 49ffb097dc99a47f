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
public class CandidateRow {
    private int year;
    private LocalDate eventDate;
    private OffsetDateTime observedAt;
    private String body;
    private String phenomenonType;
    private String dayPart;
    private double azimuth;
    private double elevation;
    private Double moonPhase;
    private Double moonIllumination;
    private double atmosphericFactor;
}
