package com.pathtopology.engine.dto;

import com.pathtopology.engine.entity.PathSegment;
import org.locationtech.jts.io.WKTWriter;

import java.time.LocalDateTime;

/**
 * API view of a path segment.
 */
public record SegmentRecord(
    Long id,
    String wkt,
    String cadastralWkt,
    Double length,
    Integer minElevation,
    Integer maxElevation,
    Integer ascent,
    Integer descent,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static SegmentRecord fromEntity(PathSegment segment) {
        WKTWriter writer = new WKTWriter(3);
        return new SegmentRecord(
            segment.getId(),
            segment.getGeometry() == null ? null : writer.write(segment.getGeometry()),
            segment.getCadastralGeometry() == null ? null : writer.write(segment.getCadastralGeometry()),
            segment.getLength(),
            segment.getMinElevation(),
            segment.getMaxElevation(),
            segment.getAscent(),
            segment.getDescent(),
            segment.getCreatedAt(),
            segment.getUpdatedAt()
        );
    }
}
