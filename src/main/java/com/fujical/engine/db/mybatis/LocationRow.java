package com.fujical.engine.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationRow {
    private long id;
    private String name;
    private double latitude;
    private double longitude;
    private double elevation;
}
