package com.fujical.engine.geo;

import java.util.Locale;

/**
 * Geographic position on the spherical Earth model.
 */
public final class GeoPoint {
    public final double latitude;
    public final double longitude;
    public final double elevationMeters;

    public GeoPoint(double latitude, double longitude, double elevationMeters) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude) || !Double.isFinite(elevationMeters)) {
            throw new InvalidCoordinatesException(String.format(
                    Locale.US,
                    "non-finite coordinates lat=%s lon=%s elevation=%s",
                    latitude,
                    longitude,
                    elevationMeters
            ));
        }
        if (latitude < -90.0 || latitude > 90.0) {
            throw new InvalidCoordinatesException("latitude out of range: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new InvalidCoordinatesException("longitude out of range: " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevationMeters = elevationMeters;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f, %.1fm)", latitude, longitude, elevationMeters);
    }
}
