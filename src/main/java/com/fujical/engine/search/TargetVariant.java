package com.fujical.engine.search;

import com.fujical.engine.model.CelestialBody;

import java.util.List;

/**
 * Which part of the disk sits on the summit. Declaration order is the tie-break order.
 */
public enum TargetVariant {
    CENTER,
    TOP,
    BOTTOM;

    /**
     * Body-center elevation that puts this part of the disk on the summit.
     */
    public double targetElevation(double fujiElevation, CelestialBody body) {
        double radius = body.angularRadiusDeg();
        switch (this) {
            case TOP:
                return fujiElevation - radius;
            case BOTTOM:
                return fujiElevation + radius;
            default:
                return fujiElevation;
        }
    }

    public static List<TargetVariant> forBody(CelestialBody body) {
        if (body == CelestialBody.SUN) {
            return List.of(CENTER, TOP, BOTTOM);
        }
        return List.of(CENTER, BOTTOM);
    }
}
