package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.BoundaryCrossingRecord;
import com.pathtopology.engine.dto.EventRecord;
import com.pathtopology.engine.dto.SegmentRecord;
import com.pathtopology.engine.dto.SegmentRequest;
import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.EventOrigin;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.exception.InvalidGeometryException;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.geometry.WktGeometryReader;
import com.pathtopology.engine.repository.PathSegmentRepository;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import com.pathtopology.engine.service.boundary.AdministrativeLayerBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.PrecisionModel;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PathSegmentServiceTest {

    @Mock
    private SegmentWritePipeline writePipeline;

    @Mock
    private PathSegmentRepository segmentRepository;

    @Mock
    private TopologyEventRepository eventRepository;

    @Mock
    private SegmentEventLinkRepository linkRepository;

    @Mock
    private AdministrativeLayerBinding cityBinding;

    private WktGeometryReader wktReader;
    private PathSegmentService service;

    @BeforeEach
    void setUp() {
        wktReader = new WktGeometryReader(new GeometryFactory(new PrecisionModel(), 2154));
        service = new PathSegmentService(writePipeline, wktReader, segmentRepository, eventRepository,
            linkRepository, List.of(cityBinding));
    }

    @Test
    void shouldParseWktBeforeRunningThePipeline() {
        when(writePipeline.onSegmentInserted(any(), isNull())).thenAnswer(invocation -> PathSegment.builder()
            .id(1L)
            .geometry(invocation.getArgument(0))
            .build());

        SegmentRecord created = service.create(new SegmentRequest("LINESTRING (0 0, 10 0)", " "));

        ArgumentCaptor<Geometry> parsed = ArgumentCaptor.forClass(Geometry.class);
        verify(writePipeline).onSegmentInserted(parsed.capture(), isNull());
        assertThat(parsed.getValue()).isInstanceOf(LineString.class);
        assertThat(parsed.getValue().getSRID()).isEqualTo(2154);
        assertThat(created.id()).isEqualTo(1L);
        assertThat(created.wkt()).startsWith("LINESTRING");
    }

    @Test
    void shouldPassCadastralLineAlong() {
        when(writePipeline.onSegmentInserted(any(), any())).thenAnswer(invocation -> PathSegment.builder()
            .id(2L)
            .geometry(invocation.getArgument(0))
            .cadastralGeometry(invocation.getArgument(1))
            .build());

        SegmentRecord created = service.create(
            new SegmentRequest("LINESTRING (0 0, 10 0)", "LINESTRING (0 1, 10 1)"));

        assertThat(created.cadastralWkt()).startsWith("LINESTRING");
    }

    @Test
    void shouldRejectUnparseableWkt() {
        assertThatThrownBy(() -> service.create(new SegmentRequest("LINESTRING (0 0,", null)))
            .isInstanceOf(InvalidGeometryException.class);
        verifyNoInteractions(writePipeline);
    }

    @Test
    void shouldRejectCadastralGeometryThatIsNotALine() {
        assertThatThrownBy(() -> service.create(new SegmentRequest("LINESTRING (0 0, 10 0)", "POINT (1 1)")))
            .isInstanceOf(InvalidGeometryException.class)
            .hasMessageContaining("LINESTRING");
        verifyNoInteractions(writePipeline);
    }

    @Test
    void shouldFailOnUnknownSegment() {
        when(segmentRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getSegment(9L)).isInstanceOf(SegmentNotFoundException.class);
    }

    @Test
    void shouldListEventsWithTheirLinks() {
        when(segmentRepository.findById(1L)).thenReturn(Optional.of(PathSegment.builder().id(1L).build()));
        TopologyEvent bench = TopologyEvent.builder().id(10L).kind("BENCH").build();
        when(eventRepository.findLinkedToSegment(1L)).thenReturn(List.of(bench));
        when(linkRepository.findByEventIdIn(List.of(10L))).thenReturn(List.of(
            SegmentEventLink.of(1L, 10L, 0.4, 0.4),
            SegmentEventLink.of(2L, 10L, 0.1, 0.1, 1)
        ));

        List<EventRecord> events = service.getEvents(1L);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.kind()).isEqualTo("BENCH");
            assertThat(event.links()).hasSize(2);
        });
    }

    @Test
    void shouldGroupBoundaryCrossingsByLayer() {
        when(segmentRepository.findById(1L)).thenReturn(Optional.of(PathSegment.builder().id(1L).build()));
        when(linkRepository.findBySegmentId(1L)).thenReturn(List.of(
            SegmentEventLink.of(1L, 100L, 0.4, 1.0),
            SegmentEventLink.of(1L, 200L, 0.5, 0.5)
        ));
        when(eventRepository.findLinkedToSegment(1L)).thenReturn(List.of(
            TopologyEvent.builder().id(100L).kind("CITYEDGE").origin(EventOrigin.CITY_EDGE).build(),
            TopologyEvent.builder().id(200L).kind("BENCH").build()
        ));
        when(cityBinding.layer()).thenReturn(AdministrativeLayer.CITY);
        when(cityBinding.findAreaIds(List.of(100L))).thenReturn(Map.of(100L, "75056"));

        Map<AdministrativeLayer, List<BoundaryCrossingRecord>> crossings = service.getBoundaries(1L);

        assertThat(crossings).containsOnlyKeys(AdministrativeLayer.CITY);
        assertThat(crossings.get(AdministrativeLayer.CITY)).containsExactly(
            new BoundaryCrossingRecord(100L, AdministrativeLayer.CITY, "75056", 0.4, 1.0));
    }
}
