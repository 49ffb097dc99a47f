package com.fujical.engine.model;

import com.fujical.engine.geo.FujiGeometry;
import com.fujical.engine.geo.GeoAstronomy;
import com.fujical.engine.geo.GeoPoint;

/**
 * Registered observation point. Fuji bearing, elevation and distance are always
 * derived together from the coordinates at construction time.
 */
public final class ObserverLocation {
    public final long id;
    public final String name;
    public final double latitude;
    public final double longitude;
    public final double elevation;
    public final double fujiBearing;
    public final double fujiElevation;
    public final double fujiDistance;

    private ObserverLocation(long id, String name, GeoPoint point, FujiGeometry geometry) {
        this.id = id;
        this.name = name == null ? "" : name.trim();
        this.latitude = point.latitude;
        this.longitude = point.longitude;
        this.elevation = point.elevationMeters;
        this.fujiBearing = geometry.bearing();
        this.fujiElevation = geometry.elevation();
        this.fujiDistance = geometry.distanceMeters();
    }

    public static ObserverLocation of(long id, String name, double latitude, double longitude, double elevation) {
        GeoPoint point = new GeoPoint(latitude, longitude, elevation);
        return new ObserverLocation(id, name, point, GeoAstronomy.fujiGeometry(point));
    }

    public ObserverLocation movedTo(double latitude, double longitude, double elevation) {
        return of(id, name, latitude, longitude, elevation);
    }

    public GeoPoint point() {
        return new GeoPoint(latitude, longitude, elevation);
    }

    public double fujiDistanceKm() {
        return fujiDistance / 1000.0;
    }

    @Override
    public String toString() {
        return "ObserverLocation{id=" + id + ", name=" + name + ", bearing=" + fujiBearing
                + ", elevation=" + fujiElevation + ", distance=" + fujiDistance + "}";
    }
}
