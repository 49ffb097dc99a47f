package com.fujical.engine.geo;

/**
 * Observer-to-target geometry on a spherical Earth with curvature and refraction corrections.
 */
public final class GeoAstronomy {
    public static final double EARTH_RADIUS_M = 6_371_000.0;
    public static final double EYE_HEIGHT_M = 1.7;
    public static final double TERRESTRIAL_REFRACTION_COEFFICIENT = 0.13;

    public static final GeoPoint FUJI_SUMMIT = new GeoPoint(35.3628, 138.730781, 3776.0);

    private static final double LOW_ALTITUDE_REFRACTION_DEG = 0.57;

    private GeoAstronomy() {
    }

    /**
     * Initial great-circle bearing from observer to target, in [0, 360).
     */
    public static double bearingTo(GeoPoint observer, GeoPoint target) {
        requirePoints(observer, target);
        double lat1 = Math.toRadians(observer.latitude);
        double lat2 = Math.toRadians(target.latitude);
        double dLon = Math.toRadians(target.longitude - observer.longitude);

        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        return normalizeAzimuth(Math.toDegrees(Math.atan2(y, x)));
    }

    /**
     * Haversine surface distance in meters.
     */
    public static double distanceTo(GeoPoint observer, GeoPoint target) {
        requirePoints(observer, target);
        double lat1 = Math.toRadians(observer.latitude);
        double lat2 = Math.toRadians(target.latitude);
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(target.longitude - observer.longitude);

        double a = Math.sin(dLat / 2.0) * Math.sin(dLat / 2.0)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2.0) * Math.sin(dLon / 2.0);
        double c = 2.0 * Math.atan2(Math.sqrt(a), Math.sqrt(Math.max(0.0, 1.0 - a)));
        return EARTH_RADIUS_M * c;
    }

    /**
     * Apparent elevation angle in degrees of the target as seen from the observer's eye.
     */
    public static double elevationAngle(GeoPoint observer, GeoPoint target, double distanceMeters) {
        requirePoints(observer, target);
        if (!Double.isFinite(distanceMeters) || distanceMeters < 0.0) {
            throw new InvalidCoordinatesException("invalid distance: " + distanceMeters);
        }
        double heightDiff = target.elevationMeters - (observer.elevationMeters + EYE_HEIGHT_M);
        double curvatureDrop = distanceMeters * distanceMeters / (2.0 * EARTH_RADIUS_M);
        double refractionLift = TERRESTRIAL_REFRACTION_COEFFICIENT * curvatureDrop;
        double apparentVertical = heightDiff - (curvatureDrop - refractionLift);
        return Math.toDegrees(Math.atan2(apparentVertical, distanceMeters));
    }

    /**
     * Astronomical refraction in degrees for a body at the given true elevation.
     * Saemundsson between 0.2 and 15 degrees, a fixed horizon value below, none above.
     */
    public static double atmosphericRefraction(double elevationDeg) {
        if (!Double.isFinite(elevationDeg)) {
            return 0.0;
        }
        if (elevationDeg > 15.0) {
            return 0.0;
        }
        if (elevationDeg <= 0.2) {
            return LOW_ALTITUDE_REFRACTION_DEG;
        }
        double arg = Math.toRadians(elevationDeg + 10.3 / (elevationDeg + 5.11));
        double arcMinutes = 1.02 / Math.tan(arg);
        return arcMinutes / 60.0;
    }

    public static FujiGeometry fujiGeometry(GeoPoint observer) {
        return geometry(observer, FUJI_SUMMIT);
    }

    public static FujiGeometry geometry(GeoPoint observer, GeoPoint target) {
        double distance = distanceTo(observer, target);
        return new FujiGeometry(
                bearingTo(observer, target),
                elevationAngle(observer, target, distance),
                distance
        );
    }

    /**
     * Smallest absolute angle between two azimuths, in [0, 180].
     */
    public static double azimuthDifference(double a, double b) {
        double diff = Math.abs(normalizeAzimuth(a) - normalizeAzimuth(b));
        return diff > 180.0 ? 360.0 - diff : diff;
    }

    public static double normalizeAzimuth(double azimuth) {
        double value = azimuth % 360.0;
        if (value < 0.0) {
            value += 360.0;
        }
        return value >= 360.0 ? 0.0 : value;
    }

    private static void requirePoints(GeoPoint observer, GeoPoint target) {
        if (observer == null || target == null) {
            throw new InvalidCoordinatesException("observer and target must not be null");
        }
    }
}
