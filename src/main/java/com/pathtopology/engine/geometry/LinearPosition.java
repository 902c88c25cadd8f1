package com.pathtopology.engine.geometry;

/**
 * Result of projecting a point onto a line.
 *
 * @param position        fraction of the line length in [0,1], 0 at the start point
 * @param lateralDistance signed perpendicular distance, positive to the left of the line direction
 */
public record LinearPosition(double position, double lateralDistance) {
}
