package com.fujical.engine.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Year-level distribution of stored events.
 */
public record EventStatistics(
        int year,
        long totalEvents,
        Map<PhenomenonType, Long> byPhenomenon,
        Map<AccuracyTier, Long> byTier,
        int locationsWithEvents
) {
    public EventStatistics {
        Map<PhenomenonType, Long> phenomena = new EnumMap<>(PhenomenonType.class);
        for (PhenomenonType type : PhenomenonType.values()) {
            phenomena.put(type, byPhenomenon == null ? 0L : byPhenomenon.getOrDefault(type, 0L));
        }
        Map<AccuracyTier, Long> tiers = new EnumMap<>(AccuracyTier.class);
        for (AccuracyTier tier : AccuracyTier.values()) {
            tiers.put(tier, byTier == null ? 0L : byTier.getOrDefault(tier, 0L));
        }
        byPhenomenon = Map.copyOf(phenomena);
        byTier = Map.copyOf(tiers);
        totalEvents = Math.max(0L, totalEvents);
        locationsWithEvents = Math.max(0, locationsWithEvents);
    }

    public static EventStatistics empty(int year) {
        return new EventStatistics(year, 0L, Map.of(), Map.of(), 0);
    }

    public long diamondEvents() {
        return byPhenomenon.get(PhenomenonType.DIAMOND_SUNRISE) + byPhenomenon.get(PhenomenonType.DIAMOND_SUNSET);
    }

    public long pearlEvents() {
        return byPhenomenon.get(PhenomenonType.PEARL_MOONRISE) + byPhenomenon.get(PhenomenonType.PEARL_MOONSET);
    }
}
