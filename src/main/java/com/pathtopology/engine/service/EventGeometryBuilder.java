package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.geometry.GeometryEngine;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.operation.linemerge.LineMerger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders an event's geometry from its links alone.
 *
 * - point event (every link has start = end): the point at the first link's
 *   position, shifted by the lateral offset
 * - linear event: the stretch of each linked segment between its positions,
 *   offset if needed, merged into one line where the stretches join and a
 *   multi-line otherwise
 */
@Component
@RequiredArgsConstructor
public class EventGeometryBuilder {

    private final GeometryEngine geometryEngine;
    private final GeometryFactory geometryFactory;

    /**
     * @param links    the event's links, in order
     * @param segments the linked segments by id
     * @param offset   the event's lateral offset
     */
    public Geometry build(List<SegmentEventLink> links, Map<Long, PathSegment> segments, double offset) {
        if (links.isEmpty()) {
            throw new IllegalArgumentException("Cannot build the geometry of an event without links");
        }

        if (links.stream().allMatch(SegmentEventLink::isPoint)) {
            SegmentEventLink first = links.get(0);
            return geometryEngine.pointAt(lineOf(first, segments), first.getStartPosition(), offset);
        }

        List<LineString> parts = new ArrayList<>();
        for (SegmentEventLink link : links) {
            if (link.isPoint()) {
                continue;
            }
            LineString stretch = geometryEngine.subLine(
                lineOf(link, segments), link.getStartPosition(), link.getEndPosition());
            parts.addAll(geometryEngine.offsetLine(stretch, offset));
        }
        return merge(parts);
    }

    private Geometry merge(List<LineString> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        LineMerger merger = new LineMerger();
        merger.add(parts);
        Collection<?> merged = merger.getMergedLineStrings();
        List<LineString> lines = new ArrayList<>(merged.size());
        for (Object part : merged) {
            lines.add((LineString) part);
        }
        if (lines.size() == 1) {
            return lines.get(0);
        }
        return geometryFactory.createMultiLineString(lines.toArray(new LineString[0]));
    }

    private static LineString lineOf(SegmentEventLink link, Map<Long, PathSegment> segments) {
        PathSegment segment = segments.get(link.getSegmentId());
        if (segment == null) {
            throw new SegmentNotFoundException(link.getSegmentId());
        }
        return segment.getGeometry();
    }
}
