package com.pathtopology.engine.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Who created an event: an API caller, or the boundary auto-linker for one
 * of the administrative layers.
 */
public enum EventOrigin {
    MANUAL,
    CITY_EDGE,
    DISTRICT_EDGE,
    RESTRICTED_AREA_EDGE;

    public boolean isBoundary() {
        return this != MANUAL;
    }

    public static Set<EventOrigin> boundaryOrigins() {
        return EnumSet.of(CITY_EDGE, DISTRICT_EDGE, RESTRICTED_AREA_EDGE);
    }
}
