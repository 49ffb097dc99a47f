package com.fujical.engine.search;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchWindowTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
    private static final LocalDate DAY = LocalDate.of(2025, 2, 10);

    @Test
    void sunriseWindowShouldCoverLocalMorning() {
        SearchWindow window = SubEvent.SUNRISE.window(DAY, TOKYO);

        assertEquals(Instant.parse("2025-02-09T19:00:00Z"), window.start());
        assertEquals(Instant.parse("2025-02-10T03:00:00Z"), window.end());
        assertFalse(window.contains(window.end()));
    }

    @Test
    void moonWindowsShouldCoverTheWholeLocalDayOnce() {
        SearchWindow rising = SubEvent.RISING.window(DAY, TOKYO);
        SearchWindow setting = SubEvent.SETTING.window(DAY, TOKYO);
        SearchWindow nextDay = SubEvent.SETTING.window(DAY.plusDays(1), TOKYO);

        assertEquals(rising, setting);
        assertEquals(Instant.parse("2025-02-09T15:00:00Z"), rising.start());
        assertEquals(Instant.parse("2025-02-10T15:00:00Z"), rising.end());
        assertTrue(rising.contains(Instant.parse("2025-02-10T14:59:59Z")));
        assertFalse(rising.contains(rising.end()));
        assertTrue(nextDay.contains(rising.end()));
    }

    @Test
    void moonSubEventsShouldSplitTheSkyAtSouth() {
        assertTrue(SubEvent.RISING.matchesAzimuth(95.0));
        assertFalse(SubEvent.RISING.matchesAzimuth(265.0));
        assertTrue(SubEvent.SETTING.matchesAzimuth(265.0));
        assertFalse(SubEvent.SETTING.matchesAzimuth(95.0));
    }

    @Test
    void clampShouldKeepInstantsInsideBounds() {
        SearchWindow window = SubEvent.SUNSET.window(DAY, TOKYO);

        assertEquals(window.start(), window.clamp(window.start().minusSeconds(120)));
        assertEquals(window.end(), window.clamp(window.end().plusSeconds(120)));
        Instant inside = window.start().plusSeconds(60);
        assertEquals(inside, window.clamp(inside));
    }

    @Test
    void reversedWindowShouldBeRejected() {
        Instant t = Instant.parse("2025-02-10T00:00:00Z");

        assertThrows(IllegalArgumentException.class, () -> new SearchWindow(t, t.minusSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new SearchWindow(t, t));
    }
}
