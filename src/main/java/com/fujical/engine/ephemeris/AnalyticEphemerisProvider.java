package com.fujical.engine.ephemeris;

import com.fujical.engine.geo.GeoAstronomy;
import com.fujical.engine.geo.GeoPoint;
import com.fujical.engine.model.CelestialBody;

import java.time.Instant;

/**
 * Self-contained ephemeris: NOAA solar position and a truncated Meeus lunar theory,
 * reduced to topocentric horizontal coordinates with atmospheric refraction.
 */
public final class AnalyticEphemerisProvider implements CelestialPositionProvider {
    private static final double AU_KM = 149_597_870.7;
    private static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.14;

    // Meeus table 47.A, principal terms: D, M, M', F multipliers, sigma-l (1e-6 deg), sigma-r (1e-3 km)
    private static final int[][] LONGITUDE_DISTANCE_TERMS = {
            {0, 0, 1, 0, 6288774, -20905355},
            {2, 0, -1, 0, 1274027, -3699111},
            {2, 0, 0, 0, 658314, -2955968},
            {0, 0, 2, 0, 213618, -569925},
            {0, 1, 0, 0, -185116, 48888},
            {0, 0, 0, 2, -114332, -3149},
            {2, 0, -2, 0, 58793, 246158},
            {2, -1, -1, 0, 57066, -152138},
            {2, 0, 1, 0, 53322, -170733},
            {2, -1, 0, 0, 45758, -204586},
            {0, 1, -1, 0, -40923, -129620},
            {1, 0, 0, 0, -34720, 108743},
            {0, 1, 1, 0, -30383, 104755},
            {2, 0, 0, -2, 15327, 10321},
            {0, 0, 1, 2, -12528, 0},
            {0, 0, 1, -2, 10980, 79661},
            {4, 0, -1, 0, 10675, -34782},
            {0, 0, 3, 0, 10034, -23210},
            {4, 0, -2, 0, 8548, -21636},
            {2, 1, -1, 0, -7888, 24208},
            {2, 1, 0, 0, -6766, 30824},
            {1, 0, -1, 0, -5163, -8379},
            {1, 1, 0, 0, 4987, -16675},
            {2, -1, 1, 0, 4036, -12831},
            {2, 0, 2, 0, 3994, -10445},
            {4, 0, 0, 0, 3861, -11650},
            {2, 0, -3, 0, 3665, 14403},
            {0, 1, -2, 0, -2689, -7003},
            {2, 0, -1, 2, -2602, 0},
            {2, -1, -2, 0, 2390, 10056},
            {1, 0, 1, 0, -2348, 6322},
            {2, -2, 0, 0, 2236, -9884}
    };

    // Meeus table 47.B, principal terms: D, M, M', F multipliers, sigma-b (1e-6 deg)
    private static final int[][] LATITUDE_TERMS = {
            {0, 0, 0, 1, 5128122},
            {0, 0, 1, 1, 280602},
            {0, 0, 1, -1, 277693},
            {2, 0, 0, -1, 173237},
            {2, 0, -1, 1, 55413},
            {2, 0, -1, -1, 46271},
            {2, 0, 0, 1, 32573},
            {0, 0, 2, 1, 17198},
            {2, 0, 1, -1, 9266},
            {0, 0, 2, -1, 8822},
            {2, -1, 0, -1, 8216},
            {2, 0, -2, -1, 4324},
            {2, 0, 1, 1, 4200},
            {2, 1, 0, -1, -3359},
            {2, -1, -1, 1, 2463},
            {2, -1, 0, 1, 2211},
            {2, -1, -1, -1, 2065}
    };

    @Override
    public CelestialPosition position(CelestialBody body, Instant instant, GeoPoint observer) {
        if (body == null || instant == null || observer == null) {
            throw new ProviderUnavailableException("body, instant and observer are required");
        }
        double jd = julianDay(instant);
        if (!Double.isFinite(jd)) {
            throw new ProviderUnavailableException("instant outside supported range: " + instant);
        }
        double t = (jd - 2451545.0) / 36525.0;
        SolarCoordinates sun = solarCoordinates(t);
        if (body == CelestialBody.SUN) {
            Horizontal h = toHorizontal(sun.rightAscension, sun.declination, jd, t, observer);
            double apparent = h.elevation + GeoAstronomy.atmosphericRefraction(h.elevation);
            return CelestialPosition.sun(h.azimuth, apparent, sun.radiusAu * AU_KM);
        }

        LunarCoordinates moon = lunarCoordinates(t, sun.obliquity);
        Horizontal h = toHorizontal(moon.rightAscension, moon.declination, jd, t, observer);
        double parallax = Math.toDegrees(Math.asin(EARTH_EQUATORIAL_RADIUS_KM / moon.distanceKm));
        double topocentric = h.elevation - Math.toDegrees(Math.asin(
                Math.sin(Math.toRadians(parallax)) * Math.cos(Math.toRadians(h.elevation))));
        double apparent = topocentric + GeoAstronomy.atmosphericRefraction(topocentric);

        double elongationLon = Math.toRadians(moon.longitude - sun.apparentLongitude);
        double cosElongation = Math.cos(Math.toRadians(moon.latitude)) * Math.cos(elongationLon);
        double illuminated = clamp01((1.0 - cosElongation) / 2.0);
        double phase = modulo(moon.longitude - sun.apparentLongitude, 360.0) / 360.0;
        if (!Double.isFinite(h.azimuth) || !Double.isFinite(apparent)) {
            throw new ProviderUnavailableException("lunar position diverged at " + instant);
        }
        return CelestialPosition.moon(h.azimuth, apparent, moon.distanceKm, phase, illuminated);
    }

    static double julianDay(Instant instant) {
        double seconds = instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
        return seconds / 86400.0 + 2440587.5;
    }

    private SolarCoordinates solarCoordinates(double t) {
        double geomMeanLong = modulo(280.46646 + t * (36000.76983 + t * 0.0003032), 360.0);
        double geomMeanAnom = 357.52911 + t * (35999.05029 - 0.0001537 * t);
        double eccentricity = 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
        double anomRad = Math.toRadians(geomMeanAnom);
        double eqOfCenter = Math.sin(anomRad) * (1.914602 - t * (0.004817 + 0.000014 * t))
                + Math.sin(2 * anomRad) * (0.019993 - 0.000101 * t)
                + Math.sin(3 * anomRad) * 0.000289;
        double trueLong = geomMeanLong + eqOfCenter;
        double trueAnom = geomMeanAnom + eqOfCenter;
        double radiusAu = (1.000001018 * (1 - eccentricity * eccentricity))
                / (1 + eccentricity * Math.cos(Math.toRadians(trueAnom)));
        double omega = Math.toRadians(125.04 - 1934.136 * t);
        double apparentLong = trueLong - 0.00569 - 0.00478 * Math.sin(omega);
        double meanObliquity = 23.0 + (26.0 + (21.448 - t * (46.815 + t * (0.00059 - t * 0.001813))) / 60.0) / 60.0;
        double obliquity = meanObliquity + 0.00256 * Math.cos(omega);

        double lambda = Math.toRadians(apparentLong);
        double eps = Math.toRadians(obliquity);
        double ra = Math.toDegrees(Math.atan2(Math.cos(eps) * Math.sin(lambda), Math.cos(lambda)));
        double dec = Math.toDegrees(Math.asin(Math.sin(eps) * Math.sin(lambda)));
        return new SolarCoordinates(modulo(ra, 360.0), dec, modulo(apparentLong, 360.0), obliquity, radiusAu);
    }

    private LunarCoordinates lunarCoordinates(double t, double obliquity) {
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;
        double meanLong = 218.3164477 + 481267.88123421 * t - 0.0015786 * t2 + t3 / 538841.0 - t4 / 65194000.0;
        double elongation = 297.8501921 + 445267.1114034 * t - 0.0018819 * t2 + t3 / 545868.0 - t4 / 113065000.0;
        double sunAnomaly = 357.5291092 + 35999.0502909 * t - 0.0001536 * t2 + t3 / 24490000.0;
        double moonAnomaly = 134.9633964 + 477198.8675055 * t + 0.0087414 * t2 + t3 / 69699.0 - t4 / 14712000.0;
        double latitudeArg = 93.2720950 + 483202.0175233 * t - 0.0036539 * t2 - t3 / 3526000.0 + t4 / 863310000.0;
        double e = 1.0 - 0.002516 * t - 0.0000074 * t2;

        double sumL = 0.0;
        double sumR = 0.0;
        for (int[] term : LONGITUDE_DISTANCE_TERMS) {
            double arg = Math.toRadians(term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly + term[3] * latitudeArg);
            double factor = eccentricityFactor(term[1], e);
            sumL += term[4] * factor * Math.sin(arg);
            sumR += term[5] * factor * Math.cos(arg);
        }
        double sumB = 0.0;
        for (int[] term : LATITUDE_TERMS) {
            double arg = Math.toRadians(term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly + term[3] * latitudeArg);
            sumB += term[4] * eccentricityFactor(term[1], e) * Math.sin(arg);
        }

        double a1 = Math.toRadians(119.75 + 131.849 * t);
        double a2 = Math.toRadians(53.09 + 479264.290 * t);
        double a3 = Math.toRadians(313.45 + 481266.484 * t);
        double lRad = Math.toRadians(meanLong);
        double fRad = Math.toRadians(latitudeArg);
        double mpRad = Math.toRadians(moonAnomaly);
        sumL += 3958 * Math.sin(a1) + 1962 * Math.sin(lRad - fRad) + 318 * Math.sin(a2);
        sumB += -2235 * Math.sin(lRad) + 382 * Math.sin(a3) + 175 * Math.sin(a1 - fRad)
                + 175 * Math.sin(a1 + fRad) + 127 * Math.sin(lRad - mpRad) - 115 * Math.sin(lRad + mpRad);

        double omega = Math.toRadians(125.04 - 1934.136 * t);
        double longitude = modulo(meanLong + sumL / 1_000_000.0 - 0.00478 * Math.sin(omega), 360.0);
        double latitude = sumB / 1_000_000.0;
        double distanceKm = 385000.56 + sumR / 1000.0;

        double lambda = Math.toRadians(longitude);
        double beta = Math.toRadians(latitude);
        double eps = Math.toRadians(obliquity);
        double ra = Math.toDegrees(Math.atan2(
                Math.sin(lambda) * Math.cos(eps) - Math.tan(beta) * Math.sin(eps),
                Math.cos(lambda)));
        double dec = Math.toDegrees(Math.asin(
                Math.sin(beta) * Math.cos(eps) + Math.cos(beta) * Math.sin(eps) * Math.sin(lambda)));
        return new LunarCoordinates(modulo(ra, 360.0), dec, longitude, latitude, distanceKm);
    }

    private Horizontal toHorizontal(double raDeg, double decDeg, double jd, double t, GeoPoint observer) {
        double gmst = modulo(280.46061837 + 360.98564736629 * (jd - 2451545.0)
                + 0.000387933 * t * t - t * t * t / 38710000.0, 360.0);
        double hourAngle = Math.toRadians(modulo(gmst + observer.longitude - raDeg, 360.0));
        double lat = Math.toRadians(observer.latitude);
        double dec = Math.toRadians(decDeg);

        double sinAlt = Math.sin(lat) * Math.sin(dec) + Math.cos(lat) * Math.cos(dec) * Math.cos(hourAngle);
        double elevation = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, sinAlt))));
        double y = -Math.sin(hourAngle) * Math.cos(dec);
        double x = Math.sin(dec) * Math.cos(lat) - Math.cos(dec) * Math.sin(lat) * Math.cos(hourAngle);
        double azimuth = GeoAstronomy.normalizeAzimuth(Math.toDegrees(Math.atan2(y, x)));
        return new Horizontal(azimuth, elevation);
    }

    private static double eccentricityFactor(int sunAnomalyMultiplier, double e) {
        int k = Math.abs(sunAnomalyMultiplier);
        if (k == 1) {
            return e;
        }
        if (k == 2) {
            return e * e;
        }
        return 1.0;
    }

    private static double modulo(double value, double divisor) {
        double out = value % divisor;
        return out < 0 ? out + divisor : out;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record SolarCoordinates(
            double rightAscension,
            double declination,
            double apparentLongitude,
            double obliquity,
            double radiusAu
    ) {
    }

    private record LunarCoordinates(
            double rightAscension,
            double declination,
            double longitude,
            double latitude,
            double distanceKm
    ) {
    }

    private record Horizontal(double azimuth, double elevation) {
    }
}
