package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.exception.NonSimpleGeometryException;
import com.pathtopology.engine.exception.SegmentOverlapException;
import com.pathtopology.engine.geometry.GeometryEngine;
import com.pathtopology.engine.repository.PathSegmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Gatekeeper for segment geometries.
 *
 * Rules:
 * - the geometry is a non-empty, simple LINESTRING
 * - it shares no sub-line with any other segment
 *
 * Crossing another segment at interior points and touching it at endpoints
 * are both legal: the intersection is then a point or a multi-point. The
 * test is exact, there is no buffer around either line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OverlapValidator {

    private final PathSegmentRepository segmentRepository;
    private final GeometryEngine geometryEngine;

    /**
     * @param segmentId id of the segment being edited, or null for a new segment
     * @param geometry  proposed geometry
     * @return the geometry as a line, once accepted
     * @throws NonSimpleGeometryException when the geometry is not a simple line
     * @throws SegmentOverlapException    when it overlaps another segment
     */
    public LineString validate(Long segmentId, Geometry geometry) {
        LineString line = requireSimpleLine(segmentId, geometry);

        Optional<PathSegment> overlapping = findOverlapping(segmentId, line);
        if (overlapping.isPresent()) {
            Long conflictingId = overlapping.get().getId();
            log.warn("Rejected geometry of segment {}: overlaps segment {}",
                segmentId == null ? "(new)" : segmentId, conflictingId);
            throw new SegmentOverlapException(segmentId, conflictingId);
        }
        return line;
    }

    public boolean isAcceptable(Long segmentId, Geometry geometry) {
        return isSimpleLine(geometry) && findOverlapping(segmentId, geometry).isEmpty();
    }

    /**
     * First existing segment whose intersection with the geometry contains a line.
     */
    public Optional<PathSegment> findOverlapping(Long segmentId, Geometry geometry) {
        List<PathSegment> candidates = segmentId == null
            ? segmentRepository.findIntersecting(geometry)
            : segmentRepository.findIntersectingOthers(segmentId, geometry);

        return candidates.stream()
            .filter(other -> geometryEngine.hasLinearComponent(
                geometryEngine.intersection(other.getGeometry(), geometry)))
            .findFirst();
    }

    private LineString requireSimpleLine(Long segmentId, Geometry geometry) {
        if (!(geometry instanceof LineString line) || line.isEmpty()) {
            throw new NonSimpleGeometryException("Segment geometry must be a non-empty LINESTRING, got "
                + (geometry == null ? "nothing" : geometry.getGeometryType()));
        }
        if (!geometryEngine.isSimple(line)) {
            log.warn("Rejected geometry of segment {}: self-intersecting", segmentId == null ? "(new)" : segmentId);
            throw new NonSimpleGeometryException("Segment geometry intersects itself");
        }
        return line;
    }

    private boolean isSimpleLine(Geometry geometry) {
        return geometry instanceof LineString && !geometry.isEmpty() && geometryEngine.isSimple(geometry);
    }
}
