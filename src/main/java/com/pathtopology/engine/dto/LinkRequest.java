package com.pathtopology.engine.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Linear reference of a manual event on one segment. Start and end may be
 * given in either order; equal values make a point.
 */
public record LinkRequest(
    @NotNull(message = "Segment id is required")
    Long segmentId,

    @NotNull(message = "Start position is required")
    @DecimalMin(value = "0.0", message = "Positions must be >= 0")
    @DecimalMax(value = "1.0", message = "Positions must be <= 1")
    Double start,

    @NotNull(message = "End position is required")
    @DecimalMin(value = "0.0", message = "Positions must be >= 0")
    @DecimalMax(value = "1.0", message = "Positions must be <= 1")
    Double end
) {
}
