package com.pathtopology.engine.service.elevation;

import org.locationtech.jts.geom.LineString;

/**
 * Draped line and its elevation indicators, all in metres.
 *
 * @param line3d       the input line densified and carrying a Z on every vertex
 * @param minElevation lowest sampled height
 * @param maxElevation highest sampled height
 * @param ascent       sum of the positive height differences between consecutive vertices
 * @param descent      sum of the negative height differences, as a positive magnitude
 */
public record ElevationProfile(
    LineString line3d,
    int minElevation,
    int maxElevation,
    int ascent,
    int descent
) {
}
