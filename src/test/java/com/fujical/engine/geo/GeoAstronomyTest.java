package com.fujical.engine.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoAstronomyTest {

    private static final GeoPoint TOKYO_STATION = new GeoPoint(35.6812, 139.7671, 3.0);
    private static final GeoPoint EAST_OF_FUJI = new GeoPoint(35.3628, 139.5, 0.0);

    @Test
    void bearingFromDueEastShouldPointWest() {
        double bearing = GeoAstronomy.bearingTo(EAST_OF_FUJI, GeoAstronomy.FUJI_SUMMIT);

        assertEquals(270.0, bearing, 1.0);
    }

    @Test
    void bearingShouldBeNormalizedAndReciprocal() {
        double out = GeoAstronomy.bearingTo(TOKYO_STATION, GeoAstronomy.FUJI_SUMMIT);
        double back = GeoAstronomy.bearingTo(GeoAstronomy.FUJI_SUMMIT, TOKYO_STATION);

        assertTrue(out >= 0.0 && out < 360.0);
        assertTrue(back >= 0.0 && back < 360.0);
        assertEquals(180.0, GeoAstronomy.azimuthDifference(out, back), 1.5);
    }

    @Test
    void distanceFromTokyoShouldBeAboutOneHundredKilometres() {
        double meters = GeoAstronomy.distanceTo(TOKYO_STATION, GeoAstronomy.FUJI_SUMMIT);

        assertTrue(meters > 95_000.0 && meters < 105_000.0, "distance=" + meters);
        assertEquals(meters, GeoAstronomy.distanceTo(GeoAstronomy.FUJI_SUMMIT, TOKYO_STATION), 1e-6);
        assertEquals(0.0, GeoAstronomy.distanceTo(TOKYO_STATION, TOKYO_STATION), 1e-9);
    }

    @Test
    void elevationAngleShouldIncludeCurvatureAndRefraction() {
        double distance = GeoAstronomy.distanceTo(EAST_OF_FUJI, GeoAstronomy.FUJI_SUMMIT);
        double apparent = GeoAstronomy.elevationAngle(EAST_OF_FUJI, GeoAstronomy.FUJI_SUMMIT, distance);
        double flatEarth = Math.toDegrees(Math.atan2(
                GeoAstronomy.FUJI_SUMMIT.elevationMeters - GeoAstronomy.EYE_HEIGHT_M, distance));

        assertTrue(apparent > 2.0 && apparent < 3.5, "elevation=" + apparent);
        assertTrue(apparent < flatEarth);
    }

    @Test
    void summitShouldLookHigherFromCloser() {
        GeoPoint near = new GeoPoint(35.3628, 139.0, 0.0);
        FujiGeometry nearGeometry = GeoAstronomy.fujiGeometry(near);
        FujiGeometry farGeometry = GeoAstronomy.fujiGeometry(EAST_OF_FUJI);

        assertTrue(nearGeometry.elevation() > farGeometry.elevation());
        assertTrue(nearGeometry.distanceKm() < farGeometry.distanceKm());
    }

    @Test
    void levelTargetShouldSitJustBelowTheEyeAndApproachHorizon() {
        GeoPoint observer = new GeoPoint(35.0, 139.0, 500.0);
        GeoPoint target = new GeoPoint(35.0, 139.001, 500.0);

        double near = GeoAstronomy.elevationAngle(observer, target, 100.0);
        double far = GeoAstronomy.elevationAngle(observer, target, 1_000.0);

        assertTrue(near < 0.0 && far < 0.0);
        assertTrue(far > near);
        assertEquals(0.0, far, 0.2);
    }

    @Test
    void elevationAngleShouldRejectNegativeDistance() {
        assertThrows(InvalidCoordinatesException.class,
                () -> GeoAstronomy.elevationAngle(EAST_OF_FUJI, GeoAstronomy.FUJI_SUMMIT, -1.0));
    }

    @Test
    void atmosphericRefractionShouldFollowAltitudeBands() {
        assertEquals(0.57, GeoAstronomy.atmosphericRefraction(0.0), 1e-9);
        assertEquals(0.57, GeoAstronomy.atmosphericRefraction(-3.0), 1e-9);
        assertEquals(0.0, GeoAstronomy.atmosphericRefraction(20.0), 1e-9);
        double mid = GeoAstronomy.atmosphericRefraction(5.0);
        assertTrue(mid > 0.1 && mid < 0.57, "refraction=" + mid);
        assertTrue(GeoAstronomy.atmosphericRefraction(2.0) > GeoAstronomy.atmosphericRefraction(10.0));
    }

    @Test
    void azimuthDifferenceShouldWrapAroundNorth() {
        assertEquals(2.0, GeoAstronomy.azimuthDifference(359.0, 1.0), 1e-9);
        assertEquals(20.0, GeoAstronomy.azimuthDifference(10.0, 350.0), 1e-9);
        assertEquals(180.0, GeoAstronomy.azimuthDifference(0.0, 180.0), 1e-9);
        assertEquals(5.0, GeoAstronomy.azimuthDifference(-5.0, 360.0), 1e-9);
    }

    @Test
    void normalizeAzimuthShouldMapIntoHalfOpenRange() {
        assertEquals(270.0, GeoAstronomy.normalizeAzimuth(-90.0), 1e-9);
        assertEquals(0.0, GeoAstronomy.normalizeAzimuth(720.0), 1e-9);
        assertEquals(45.0, GeoAstronomy.normalizeAzimuth(405.0), 1e-9);
    }

    @Test
    void geoPointShouldRejectOutOfRangeOrNonFiniteCoordinates() {
        assertThrows(InvalidCoordinatesException.class, () -> new GeoPoint(91.0, 0.0, 0.0));
        assertThrows(InvalidCoordinatesException.class, () -> new GeoPoint(0.0, 181.0, 0.0));
        assertThrows(InvalidCoordinatesException.class, () -> new GeoPoint(Double.NaN, 0.0, 0.0));
        assertThrows(InvalidCoordinatesException.class, () -> new GeoPoint(0.0, 0.0, Double.POSITIVE_INFINITY));
    }
}
