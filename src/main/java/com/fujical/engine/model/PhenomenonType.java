package com.fujical.engine.model;

import java.util.Locale;

public enum PhenomenonType {
    DIAMOND_SUNRISE(CelestialBody.SUN),
    DIAMOND_SUNSET(CelestialBody.SUN),
    PEARL_MOONRISE(CelestialBody.MOON),
    PEARL_MOONSET(CelestialBody.MOON);

    private final CelestialBody body;

    PhenomenonType(CelestialBody body) {
        this.body = body;
    }

    public CelestialBody body() {
        return body;
    }

    public boolean diamond() {
        return body == CelestialBody.SUN;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PhenomenonType of(CelestialBody body, boolean rising) {
        if (body == CelestialBody.SUN) {
            return rising ? DIAMOND_SUNRISE : DIAMOND_SUNSET;
        }
        return rising ? PEARL_MOONRISE : PEARL_MOONSET;
    }

    /**
     * Rising phenomena are seen in the eastern half of the sky.
     */
    public static PhenomenonType ofAzimuth(CelestialBody body, double azimuth) {
        return of(body, azimuth < 180.0);
    }

    public static PhenomenonType fromCode(String raw) {
        return PhenomenonType.valueOf(raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT));
    }
}
