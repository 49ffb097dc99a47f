package com.fujical.engine.geo;

/**
 * Bearing (deg), apparent elevation (deg) and surface distance (m) from an observer to the summit.
 */
public record FujiGeometry(double bearing, double elevation, double distanceMeters) {
    public double distanceKm() {
        return distanceMeters / 1000.0;
    }
}
