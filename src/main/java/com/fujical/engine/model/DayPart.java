package com.fujical.engine.model;

import java.util.Locale;

public enum DayPart {
    MORNING,
    AFTERNOON;

    public static DayPart ofHour(int localHour) {
        return localHour < 12 ? MORNING : AFTERNOON;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DayPart fromCode(String raw) {
        return DayPart.valueOf(raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT));
    }
}
