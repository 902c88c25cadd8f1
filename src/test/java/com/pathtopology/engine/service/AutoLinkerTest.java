package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.EventOrigin;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.geometry.GeometryEngine;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import com.pathtopology.engine.service.boundary.AdministrativeArea;
import com.pathtopology.engine.service.boundary.AdministrativeLayerBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutoLinkerTest {

    @Mock
    private TopologyEventRepository eventRepository;

    @Mock
    private SegmentEventLinkRepository linkRepository;

    private WKTReader wktReader;
    private FakeLayerBinding cities;
    private FakeLayerBinding districts;
    private AutoLinker autoLinker;

    private final AtomicLong eventIds = new AtomicLong(100);
    private final List<TopologyEvent> savedEvents = new ArrayList<>();
    private final List<SegmentEventLink> savedLinks = new ArrayList<>();

    @BeforeEach
    void setUp() {
        GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 2154);
        wktReader = new WKTReader(geometryFactory);
        cities = new FakeLayerBinding(AdministrativeLayer.CITY);
        districts = new FakeLayerBinding(AdministrativeLayer.DISTRICT);
        autoLinker = new AutoLinker(List.of(cities, districts), eventRepository, linkRepository,
            new GeometryEngine(geometryFactory));
    }

    @Test
    void shouldCreateOneEventForSegmentInsideACity() throws ParseException {
        recordSaves();
        cities.add("A", "POLYGON ((-5 -5, 20 -5, 20 5, -5 5, -5 -5))");

        List<Long> created = autoLinker.linkNewSegment(segment(1L, "LINESTRING (0 0, 10 0)"));

        assertThat(created).containsExactly(100L);
        assertThat(savedEvents).singleElement().satisfies(event -> {
            assertThat(event.getKind()).isEqualTo("CITYEDGE");
            assertThat(event.getOrigin()).isEqualTo(EventOrigin.CITY_EDGE);
        });
        assertThat(savedLinks).singleElement().satisfies(link -> {
            assertThat(link.getSegmentId()).isEqualTo(1L);
            assertThat(link.getEventId()).isEqualTo(100L);
            assertThat(link.getStartPosition()).isEqualTo(0.0);
            assertThat(link.getEndPosition()).isEqualTo(1.0);
        });
        assertThat(cities.edges).containsExactly(Map.entry(100L, "A"));
        assertThat(districts.edges).isEmpty();
    }

    @Test
    void shouldRegenerateBoundaryEventWithNewIdentityOnGeometryUpdate() throws ParseException {
        recordSaves();
        cities.add("A", "POLYGON ((-5 -5, 20 -5, 20 5, -5 5, -5 -5))");
        autoLinker.linkNewSegment(segment(1L, "LINESTRING (0 0, 10 0)"));
        savedLinks.clear();

        when(eventRepository.findIdsLinkedToSegmentWithOrigin(eq(1L), any())).thenReturn(List.of(100L));
        List<Long> created = autoLinker.relinkSegment(segment(1L, "LINESTRING (0 0, 5 0)"));

        assertThat(created).containsExactly(101L);
        verify(linkRepository).deleteByEventIds(List.of(100L));
        verify(eventRepository).deleteAllByIdInBatch(List.of(100L));
        assertThat(cities.edges).containsExactly(Map.entry(101L, "A"));
        assertThat(savedLinks).singleElement().satisfies(link -> {
            assertThat(link.getEventId()).isEqualTo(101L);
            assertThat(link.getStartPosition()).isEqualTo(0.0);
            assertThat(link.getEndPosition()).isEqualTo(1.0);
        });
    }

    @Test
    void shouldLinkOnlyTheStretchInsideThePolygon() throws ParseException {
        recordSaves();
        districts.add("42", "POLYGON ((4 -5, 20 -5, 20 5, 4 5, 4 -5))");

        autoLinker.linkNewSegment(segment(1L, "LINESTRING (0 0, 10 0)"));

        assertThat(savedEvents).singleElement()
            .satisfies(event -> assertThat(event.getOrigin()).isEqualTo(EventOrigin.DISTRICT_EDGE));
        assertThat(savedLinks).singleElement().satisfies(link -> {
            assertThat(link.getStartPosition()).isCloseTo(0.4, within(1e-12));
            assertThat(link.getEndPosition()).isEqualTo(1.0);
        });
        assertThat(districts.edges).containsEntry(100L, "42");
    }

    @Test
    void shouldCreateOneEventPerCrossedStretch() throws ParseException {
        recordSaves();
        cities.add("B", "MULTIPOLYGON (((1 -1, 3 -1, 3 1, 1 1, 1 -1)), ((6 -1, 8 -1, 8 1, 6 1, 6 -1)))");

        List<Long> created = autoLinker.linkNewSegment(segment(1L, "LINESTRING (0 0, 10 0)"));

        assertThat(created).hasSize(2);
        List<SegmentEventLink> links = savedLinks.stream()
            .sorted(Comparator.comparing(SegmentEventLink::getStartPosition))
            .toList();
        assertThat(links.get(0).getStartPosition()).isCloseTo(0.1, within(1e-12));
        assertThat(links.get(0).getEndPosition()).isCloseTo(0.3, within(1e-12));
        assertThat(links.get(1).getStartPosition()).isCloseTo(0.6, within(1e-12));
        assertThat(links.get(1).getEndPosition()).isCloseTo(0.8, within(1e-12));
        assertThat(cities.edges).containsOnlyKeys(created.toArray(new Long[0]));
    }

    @Test
    void shouldLinkClosedLoopInsideACityOverItsWholeLength() throws ParseException {
        recordSaves();
        cities.add("A", "POLYGON ((-5 -5, 20 -5, 20 20, -5 20, -5 -5))");

        autoLinker.linkNewSegment(segment(1L, "LINESTRING (0 0, 10 0, 10 10, 0 10, 0 0)"));

        assertThat(savedLinks).singleElement().satisfies(link -> {
            assertThat(link.getStartPosition()).isEqualTo(0.0);
            assertThat(link.getEndPosition()).isEqualTo(1.0);
            assertThat(link.isPoint()).isFalse();
        });
    }

    @Test
    void shouldIgnorePolygonTouchingTheSegmentAtOnePoint() throws ParseException {
        cities.add("C", "POLYGON ((10 0, 15 -5, 15 5, 10 0))");

        List<Long> created = autoLinker.linkNewSegment(segment(1L, "LINESTRING (0 0, 10 0)"));

        assertThat(created).isEmpty();
        verify(eventRepository, never()).save(any());
        verify(linkRepository, never()).save(any());
    }

    @Test
    void shouldDiscardNothingWhenSegmentHasNoBoundaryEvents() {
        when(eventRepository.findIdsLinkedToSegmentWithOrigin(eq(1L), any())).thenReturn(List.of());

        assertThat(autoLinker.discardBoundaryEvents(1L)).isZero();
        verify(linkRepository, never()).deleteByEventIds(any());
        verify(eventRepository, never()).deleteAllByIdInBatch(any());
    }

    @Test
    void shouldAskOnlyForBoundaryOrigins() {
        when(eventRepository.findIdsLinkedToSegmentWithOrigin(eq(1L), any())).thenAnswer(invocation -> {
            Collection<EventOrigin> origins = invocation.getArgument(1);
            assertThat(origins).doesNotContain(EventOrigin.MANUAL).hasSize(3);
            return List.of(5L, 6L);
        });

        assertThat(autoLinker.discardBoundaryEvents(1L)).isEqualTo(2);
        assertThat(cities.unlinked).containsExactly(5L, 6L);
        assertThat(districts.unlinked).containsExactly(5L, 6L);
    }

    private void recordSaves() {
        when(eventRepository.save(any(TopologyEvent.class))).thenAnswer(invocation -> {
            TopologyEvent event = invocation.getArgument(0);
            event.setId(eventIds.getAndIncrement());
            savedEvents.add(event);
            return event;
        });
        when(linkRepository.save(any(SegmentEventLink.class))).thenAnswer(invocation -> {
            SegmentEventLink link = invocation.getArgument(0);
            savedLinks.add(link);
            return link;
        });
    }

    private PathSegment segment(Long id, String wkt) throws ParseException {
        return PathSegment.builder().id(id).geometry((LineString) wktReader.read(wkt)).build();
    }

    /**
     * In-memory layer: polygons by id and the admin-link rows written for them.
     */
    private final class FakeLayerBinding implements AdministrativeLayerBinding {

        private final AdministrativeLayer layer;
        private final List<AdministrativeArea> areas = new ArrayList<>();
        private final Map<Long, String> edges = new LinkedHashMap<>();
        private final List<Long> unlinked = new ArrayList<>();

        private FakeLayerBinding(AdministrativeLayer layer) {
            this.layer = layer;
        }

        void add(String id, String wkt) throws ParseException {
            areas.add(new AdministrativeArea(id, id, wktReader.read(wkt)));
        }

        @Override
        public AdministrativeLayer layer() {
            return layer;
        }

        @Override
        public List<AdministrativeArea> findIntersecting(Geometry geometry) {
            return areas.stream().filter(area -> area.geometry().intersects(geometry)).toList();
        }

        @Override
        public void link(Long eventId, String areaId) {
            edges.put(eventId, areaId);
        }

        @Override
        public int unlink(Collection<Long> eventIds) {
            unlinked.addAll(eventIds);
            eventIds.forEach(edges::remove);
            return eventIds.size();
        }

        @Override
        public Map<Long, String> findAreaIds(Collection<Long> eventIds) {
            Map<Long, String> found = new LinkedHashMap<>();
            eventIds.stream().filter(edges::containsKey).forEach(id -> found.put(id, edges.get(id)));
            return found;
        }
    }
}
