package com.pathtopology.engine.dto;

import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.List;

/**
 * Body sent to the elevation API: the points to sample, in the engine SRID.
 */
public record ElevationLookupRequest(int srid, List<SamplePoint> points) {

    public record SamplePoint(double x, double y) {
    }

    public static ElevationLookupRequest of(int srid, Coordinate[] coordinates) {
        List<SamplePoint> points = Arrays.stream(coordinates)
            .map(coordinate -> new SamplePoint(coordinate.getX(), coordinate.getY()))
            .toList();
        return new ElevationLookupRequest(srid, points);
    }
}
