package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.exception.NonSimpleGeometryException;
import com.pathtopology.engine.exception.SegmentOverlapException;
import com.pathtopology.engine.geometry.GeometryEngine;
import com.pathtopology.engine.repository.PathSegmentRepository;
import com.pathtopology.engine.service.elevation.ElevationSampleClient;
import com.pathtopology.engine.service.elevation.RemoteElevationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OverlapValidatorTest {

    @Mock
    private PathSegmentRepository segmentRepository;

    @Mock
    private ElevationSampleClient sampleClient;

    private GeometryFactory geometryFactory;
    private WKTReader wktReader;
    private OverlapValidator validator;
    private PathSegment existing;

    @BeforeEach
    void setUp() throws ParseException {
        geometryFactory = new GeometryFactory(new PrecisionModel(), 2154);
        wktReader = new WKTReader(geometryFactory);
        validator = new OverlapValidator(segmentRepository, new GeometryEngine(geometryFactory));
        existing = PathSegment.builder()
            .id(7L)
            .geometry((LineString) wktReader.read("LINESTRING (0 0, 10 0)"))
            .build();
    }

    @Test
    void shouldRejectLineSharingAStretchWithExistingSegment() throws ParseException {
        Geometry candidate = wktReader.read("LINESTRING (5 0, 15 0)");
        when(segmentRepository.findIntersecting(any())).thenReturn(List.of(existing));

        assertThatThrownBy(() -> validator.validate(null, candidate))
            .isInstanceOfSatisfying(SegmentOverlapException.class,
                e -> assertThat(e.getConflictingSegmentId()).isEqualTo(7L));
    }

    @Test
    void shouldRejectExactCopyOfADrapedSegment() throws ParseException {
        String wkt = "LINESTRING (0.1 0.3, 97.7 61.9, 143.3 12.7)";
        when(sampleClient.fetchHeights(any())).thenAnswer(invocation -> {
            Coordinate[] samples = invocation.getArgument(0);
            return Collections.nCopies(samples.length, 310.0);
        });
        LineString draped = new RemoteElevationService(sampleClient, geometryFactory, 25.0)
            .sampleElevation((LineString) wktReader.read(wkt))
            .line3d();
        PathSegment stored = PathSegment.builder().id(9L).geometry(draped).build();
        when(segmentRepository.findIntersecting(any())).thenReturn(List.of(stored));

        assertThatThrownBy(() -> validator.validate(null, wktReader.read(wkt)))
            .isInstanceOfSatisfying(SegmentOverlapException.class,
                e -> assertThat(e.getConflictingSegmentId()).isEqualTo(9L));
    }

    @Test
    void shouldAcceptLineCrossingExistingSegment() throws ParseException {
        Geometry candidate = wktReader.read("LINESTRING (5 -5, 5 5)");
        when(segmentRepository.findIntersecting(any())).thenReturn(List.of(existing));

        LineString accepted = validator.validate(null, candidate);

        assertThat(accepted).isSameAs(candidate);
    }

    @Test
    void shouldAcceptLineTouchingExistingSegmentAtAnEndpoint() throws ParseException {
        Geometry candidate = wktReader.read("LINESTRING (10 0, 20 0)");
        when(segmentRepository.findIntersecting(any())).thenReturn(List.of(existing));

        assertThat(validator.validate(null, candidate)).isSameAs(candidate);
    }

    @Test
    void shouldRejectSelfIntersectingLineWithoutQueryingSegments() throws ParseException {
        Geometry bowtie = wktReader.read("LINESTRING (0 0, 10 10, 10 0, 0 10)");

        assertThatThrownBy(() -> validator.validate(null, bowtie))
            .isInstanceOf(NonSimpleGeometryException.class);
        verifyNoInteractions(segmentRepository);
    }

    @Test
    void shouldRejectNonLinearGeometry() throws ParseException {
        Geometry polygon = wktReader.read("POLYGON ((0 0, 1 0, 1 1, 0 0))");

        assertThatThrownBy(() -> validator.validate(null, polygon))
            .isInstanceOf(NonSimpleGeometryException.class)
            .hasMessageContaining("Polygon");
    }

    @Test
    void shouldCompareEditedSegmentAgainstOthersOnly() throws ParseException {
        Geometry moved = wktReader.read("LINESTRING (0 1, 10 1)");
        when(segmentRepository.findIntersectingOthers(eq(7L), any())).thenReturn(List.of());

        assertThat(validator.validate(7L, moved)).isSameAs(moved);
        verify(segmentRepository, never()).findIntersecting(any());
    }

    @Test
    void shouldReportAcceptabilityWithoutThrowing() throws ParseException {
        when(segmentRepository.findIntersecting(any())).thenReturn(List.of(existing));

        assertThat(validator.isAcceptable(null, wktReader.read("LINESTRING (2 0, 4 0)"))).isFalse();
        assertThat(validator.isAcceptable(null, wktReader.read("LINESTRING (2 -1, 4 1)"))).isTrue();
    }
}
