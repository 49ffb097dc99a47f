package com.fujical.engine.stage;

import com.fujical.engine.geo.GeoAstronomy;

import java.util.List;

/**
 * Inclusive azimuth interval in [0, 360]. Intervals crossing north are split in two.
 */
record AzimuthRange(double min, double max) {

    static List<AzimuthRange> around(double center, double halfWidth) {
        if (halfWidth >= 180.0) {
            return List.of(new AzimuthRange(0.0, 360.0));
        }
        double min = GeoAstronomy.normalizeAzimuth(center - halfWidth);
        double max = GeoAstronomy.normalizeAzimuth(center + halfWidth);
        if (min <= max) {
            return List.of(new AzimuthRange(min, max));
        }
        return List.of(new AzimuthRange(min, 360.0), new AzimuthRange(0.0, max));
    }
}
