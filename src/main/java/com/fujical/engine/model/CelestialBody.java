package com.fujical.engine.model;

import java.util.Locale;

public enum CelestialBody {
    SUN("sun", 0.533, -6.0),
    MOON("moon", 0.518, -2.0);

    private final String code;
    private final double angularDiameterDeg;
    private final double defaultVisibleElevation;

    CelestialBody(String code, double angularDiameterDeg, double defaultVisibleElevation) {
        this.code = code;
        this.angularDiameterDeg = angularDiameterDeg;
        this.defaultVisibleElevation = defaultVisibleElevation;
    }

    public String code() {
        return code;
    }

    public double angularDiameterDeg() {
        return angularDiameterDeg;
    }

    public double angularRadiusDeg() {
        return angularDiameterDeg / 2.0;
    }

    public double defaultVisibleElevation() {
        return defaultVisibleElevation;
    }

    public static CelestialBody fromCode(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (CelestialBody body : values()) {
            if (body.code.equals(value)) {
                return body;
            }
        }
        throw new IllegalArgumentException("unknown celestial body: " + raw);
    }
}
