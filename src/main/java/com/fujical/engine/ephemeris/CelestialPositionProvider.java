package com.fujical.engine.ephemeris;

import com.fujical.engine.geo.GeoPoint;
import com.fujical.engine.model.CelestialBody;

import java.time.Instant;

/**
 * Ephemeris boundary. Implementations must be pure and safe to call concurrently.
 * Elevations are apparent (refracted) degrees above the horizon, azimuths are clockwise from north.
 */
public interface CelestialPositionProvider {

    CelestialPosition position(CelestialBody body, Instant instant, GeoPoint observer);
}
