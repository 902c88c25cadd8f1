package com.pathtopology.engine.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * New path segment.
 *
 * @param wkt          LINESTRING in the engine SRID; any Z is ignored and replaced by draping
 * @param cadastralWkt optional LINESTRING as surveyed by the land registry
 */
public record SegmentRequest(
    @NotBlank(message = "Segment geometry is required")
    String wkt,

    String cadastralWkt
) {
}
