package com.pathtopology.engine.geometry;

import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.linearref.LengthIndexedLine;
import org.locationtech.jts.linearref.LinearLocation;
import org.locationtech.jts.linearref.LocationIndexedLine;
import org.locationtech.jts.operation.buffer.OffsetCurve;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Spatial primitives used by the topology pipeline, implemented on JTS.
 *
 * Linear positions are fractions of the planar length of a line, the same
 * measure PostGIS uses for ST_LineLocatePoint. Lateral offsets are positive
 * to the left of the line direction, as in {@link LengthIndexedLine#extractPoint(double, double)}.
 *
 * Every operation here is exact: no snapping or distance tolerance is applied.
 */
@Component
@RequiredArgsConstructor
public class GeometryEngine {

    private final GeometryFactory geometryFactory;

    public boolean intersects(Geometry a, Geometry b) {
        return a.intersects(b);
    }

    public Geometry intersection(Geometry a, Geometry b) {
        return a.intersection(b);
    }

    public GeometryKind geometryType(Geometry geometry) {
        return GeometryKind.of(geometry);
    }

    /**
     * True when the geometry is, or contains, a non-empty line.
     * A mixed collection of points and lines still counts as linear.
     */
    public boolean hasLinearComponent(Geometry geometry) {
        if (geometry == null || geometry.isEmpty()) {
            return false;
        }
        return decompose(geometry).stream()
            .anyMatch(part -> part instanceof LineString && !part.isEmpty());
    }

    public boolean isSimple(Geometry geometry) {
        return geometry.isSimple();
    }

    /**
     * Arc length including the Z dimension. Vertices without Z contribute
     * their planar distance, so the result is never below {@link Geometry#getLength()}.
     */
    public double length3D(LineString line) {
        double length = 0.0;
        for (int i = 1; i < line.getNumPoints(); i++) {
            Coordinate from = line.getCoordinateN(i - 1);
            Coordinate to = line.getCoordinateN(i);
            if (Double.isNaN(from.getZ()) || Double.isNaN(to.getZ())) {
                length += from.distance(to);
            } else {
                length += from.distance3D(to);
            }
        }
        return length;
    }

    public double locatePointAlongLine(LineString line, Point point) {
        double total = line.getLength();
        if (total == 0.0) {
            return 0.0;
        }
        double index = new LengthIndexedLine(line).project(point.getCoordinate());
        return clamp(index / total);
    }

    /**
     * Linear range covered by a stretch of the line, as {start, end}.
     *
     * The end is searched after the start, so a stretch running round a
     * closed line ends at 1 and not back at 0.
     */
    public double[] locateStretchAlongLine(LineString line, LineString stretch) {
        double total = line.getLength();
        if (total == 0.0) {
            return new double[] {0.0, 0.0};
        }
        double[] indices = new LengthIndexedLine(line).indicesOf(stretch);
        return new double[] {clamp(indices[0] / total), clamp(indices[1] / total)};
    }

    /**
     * Projects a point onto the line, returning its linear position and the
     * signed distance separating it from the line.
     */
    public LinearPosition interpolateAlong(LineString line, Point point) {
        Coordinate target = point.getCoordinate();
        LinearLocation location = new LocationIndexedLine(line).project(target);
        Coordinate projected = location.getCoordinate(line);
        double distance = projected.distance(target);

        LineSegment segment = location.getSegment(line);
        int side = segment.orientationIndex(target);
        double lateral = side < 0 ? -distance : distance;

        return new LinearPosition(locatePointAlongLine(line, point), lateral);
    }

    public Point pointAt(LineString line, double position, double offset) {
        LengthIndexedLine indexed = new LengthIndexedLine(line);
        double index = clamp(position) * line.getLength();
        Coordinate coordinate = offset == 0.0
            ? indexed.extractPoint(index)
            : indexed.extractPoint(index, offset);
        return geometryFactory.createPoint(coordinate);
    }

    public LineString subLine(LineString line, double start, double end) {
        double length = line.getLength();
        Geometry extracted = new LengthIndexedLine(line)
            .extractLine(clamp(start) * length, clamp(end) * length);
        return (LineString) extracted;
    }

    /**
     * Parallel copy of a line at the given signed distance. The result can
     * split into several parts when the line curls tighter than the offset.
     */
    public List<LineString> offsetLine(LineString line, double offset) {
        if (offset == 0.0) {
            return List.of(line);
        }
        List<LineString> parts = new ArrayList<>();
        for (Geometry part : decompose(OffsetCurve.getCurve(line, offset))) {
            if (part instanceof LineString offsetPart && !offsetPart.isEmpty()) {
                parts.add(offsetPart);
            }
        }
        return parts;
    }

    public List<Geometry> decompose(Geometry geometry) {
        List<Geometry> parts = new ArrayList<>();
        collect(geometry, parts);
        return parts;
    }

    public LineString force2D(LineString line) {
        Coordinate[] flat = new Coordinate[line.getNumPoints()];
        for (int i = 0; i < flat.length; i++) {
            Coordinate source = line.getCoordinateN(i);
            flat[i] = new Coordinate(source.getX(), source.getY());
        }
        return geometryFactory.createLineString(flat);
    }

    private void collect(Geometry geometry, List<Geometry> parts) {
        if (geometry instanceof GeometryCollection) {
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                collect(geometry.getGeometryN(i), parts);
            }
        } else if (geometry != null && !geometry.isEmpty()) {
            parts.add(geometry);
        }
    }

    private static double clamp(double fraction) {
        return Math.max(0.0, Math.min(1.0, fraction));
    }
}
