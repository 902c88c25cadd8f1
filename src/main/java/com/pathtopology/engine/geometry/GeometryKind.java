package com.pathtopology.engine.geometry;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.Point;

/**
 * Coarse geometry classification used by the overlap check.
 */
public enum GeometryKind {
    POINT,
    MULTI_POINT,
    LINE_STRING,
    MULTI_LINE_STRING,
    OTHER;

    public static GeometryKind of(Geometry geometry) {
        if (geometry instanceof Point) {
            return POINT;
        }
        if (geometry instanceof MultiPoint) {
            return MULTI_POINT;
        }
        if (geometry instanceof LineString) {
            return LINE_STRING;
        }
        if (geometry instanceof MultiLineString) {
            return MULTI_LINE_STRING;
        }
        return OTHER;
    }

    public boolean isLinear() {
        return this == LINE_STRING || this == MULTI_LINE_STRING;
    }
}
