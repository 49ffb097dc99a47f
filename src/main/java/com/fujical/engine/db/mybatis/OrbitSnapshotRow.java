package com.fujical.engine.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrbitSnapshotRow {
    private int year;
    private OffsetDateTime observedAt;
    private String body;
    private double azimuth;
    private double elevation;
    private boolean visible;
    private Double moonPhase;
    private Double moonIllumination;
}
