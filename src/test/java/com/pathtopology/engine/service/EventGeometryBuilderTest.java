package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.geometry.GeometryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EventGeometryBuilderTest {

    private static final long EVENT_ID = 10L;

    private EventGeometryBuilder builder;
    private Map<Long, PathSegment> segments;

    @BeforeEach
    void setUp() throws ParseException {
        GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 2154);
        WKTReader wktReader = new WKTReader(geometryFactory);
        builder = new EventGeometryBuilder(new GeometryEngine(geometryFactory), geometryFactory);

        segments = Map.of(
            1L, PathSegment.builder().id(1L).geometry((LineString) wktReader.read("LINESTRING (0 0, 10 0)")).build(),
            2L, PathSegment.builder().id(2L).geometry((LineString) wktReader.read("LINESTRING (10 0, 10 10)")).build()
        );
    }

    @Test
    void shouldBuildPointOnTheLine() {
        Geometry geometry = builder.build(List.of(SegmentEventLink.of(1L, EVENT_ID, 0.5, 0.5)), segments, 0.0);

        assertThat(geometry).isInstanceOf(Point.class);
        assertThat(geometry.getCoordinate().getX()).isCloseTo(5.0, within(1e-12));
        assertThat(geometry.getCoordinate().getY()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void shouldShiftPointByLateralOffset() {
        Geometry geometry = builder.build(List.of(SegmentEventLink.of(1L, EVENT_ID, 0.5, 0.5)), segments, 2.0);

        assertThat(geometry.getCoordinate().getX()).isCloseTo(5.0, within(1e-12));
        assertThat(geometry.getCoordinate().getY()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void shouldBuildStretchOfOneSegment() {
        Geometry geometry = builder.build(List.of(SegmentEventLink.of(1L, EVENT_ID, 0.2, 0.8)), segments, 0.0);

        assertThat(geometry).isInstanceOf(LineString.class);
        assertThat(geometry.getLength()).isCloseTo(6.0, within(1e-12));
    }

    @Test
    void shouldMergeStretchesThatJoin() {
        List<SegmentEventLink> links = List.of(
            SegmentEventLink.of(1L, EVENT_ID, 0.5, 1.0, 0),
            SegmentEventLink.of(2L, EVENT_ID, 0.0, 0.5, 1)
        );

        Geometry geometry = builder.build(links, segments, 0.0);

        assertThat(geometry).isInstanceOf(LineString.class);
        assertThat(geometry.getLength()).isCloseTo(10.0, within(1e-12));
    }

    @Test
    void shouldKeepDisjointStretchesApart() {
        List<SegmentEventLink> links = List.of(
            SegmentEventLink.of(1L, EVENT_ID, 0.0, 0.2, 0),
            SegmentEventLink.of(2L, EVENT_ID, 0.8, 1.0, 1)
        );

        Geometry geometry = builder.build(links, segments, 0.0);

        assertThat(geometry).isInstanceOf(MultiLineString.class);
        assertThat(geometry.getNumGeometries()).isEqualTo(2);
        assertThat(geometry.getLength()).isCloseTo(4.0, within(1e-12));
    }

    @Test
    void shouldIgnorePointLinksOfALinearEvent() {
        List<SegmentEventLink> links = List.of(
            SegmentEventLink.of(1L, EVENT_ID, 0.0, 0.5, 0),
            SegmentEventLink.of(2L, EVENT_ID, 0.3, 0.3, 1)
        );

        Geometry geometry = builder.build(links, segments, 0.0);

        assertThat(geometry).isInstanceOf(LineString.class);
        assertThat(geometry.getLength()).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void shouldFailOnUnknownSegment() {
        List<SegmentEventLink> links = List.of(SegmentEventLink.of(99L, EVENT_ID, 0.0, 1.0));

        assertThatThrownBy(() -> builder.build(links, segments, 0.0))
            .isInstanceOf(SegmentNotFoundException.class);
    }

    @Test
    void shouldRefuseEventWithoutLinks() {
        assertThatThrownBy(() -> builder.build(List.of(), segments, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
