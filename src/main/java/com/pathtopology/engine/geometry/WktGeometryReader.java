package com.pathtopology.engine.geometry;

import com.pathtopology.engine.exception.InvalidGeometryException;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.stereotype.Component;

/**
 * WKT conversion bound to the engine's geometry factory, so every parsed
 * geometry carries the configured SRID.
 */
@Component
public class WktGeometryReader {

    private final WKTReader wktReader;
    private final WKTWriter wktWriter = new WKTWriter(3);

    public WktGeometryReader(GeometryFactory geometryFactory) {
        this.wktReader = new WKTReader(geometryFactory);
    }

    public Geometry read(String wkt) {
        try {
            return wktReader.read(wkt);
        } catch (ParseException e) {
            throw new InvalidGeometryException("Unparseable WKT: " + e.getMessage(), e);
        }
    }

    public LineString readLineString(String wkt) {
        Geometry geometry = read(wkt);
        if (!(geometry instanceof LineString line)) {
            throw new InvalidGeometryException("Expected a LINESTRING but got " + geometry.getGeometryType());
        }
        return line;
    }

    public String write(Geometry geometry) {
        return geometry == null ? null : wktWriter.write(geometry);
    }
}
