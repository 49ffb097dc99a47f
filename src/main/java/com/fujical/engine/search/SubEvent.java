package com.fujical.engine.search;

import com.fujical.engine.model.CelestialBody;
import com.fujical.engine.model.PhenomenonType;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Local-time search window per phenomenon, half-open so an instant belongs to one date.
 * The moon rises and sets at any hour, so its windows span the whole local day and the
 * half of the sky a position lies in decides rising or setting.
 */
public enum SubEvent {
    SUNRISE(PhenomenonType.DIAMOND_SUNRISE, 4, 12),
    SUNSET(PhenomenonType.DIAMOND_SUNSET, 14, 20),
    RISING(PhenomenonType.PEARL_MOONRISE, 0, 24),
    SETTING(PhenomenonType.PEARL_MOONSET, 0, 24);

    private final PhenomenonType phenomenonType;
    private final int startHour;
    private final int endHour;

    SubEvent(PhenomenonType phenomenonType, int startHour, int endHour) {
        this.phenomenonType = phenomenonType;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public PhenomenonType phenomenonType() {
        return phenomenonType;
    }

    public CelestialBody body() {
        return phenomenonType.body();
    }

    /**
     * True when a body at this azimuth belongs to this sub-event's half of the sky.
     */
    public boolean matchesAzimuth(double azimuth) {
        return PhenomenonType.ofAzimuth(body(), azimuth) == phenomenonType;
    }

    public SearchWindow window(LocalDate date, ZoneId zone) {
        ZonedDateTime midnight = date.atStartOfDay(zone);
        ZonedDateTime end = endHour == 24 ? date.plusDays(1).atStartOfDay(zone) : midnight.plusHours(endHour);
        return new SearchWindow(midnight.plusHours(startHour).toInstant(), end.toInstant());
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
