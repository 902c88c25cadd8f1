package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.BoundaryCrossingRecord;
import com.pathtopology.engine.dto.CascadeOutcome;
import com.pathtopology.engine.dto.EventRecord;
import com.pathtopology.engine.dto.GeometryUpdateRequest;
import com.pathtopology.engine.dto.SegmentRecord;
import com.pathtopology.engine.dto.SegmentRequest;
import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.geometry.WktGeometryReader;
import com.pathtopology.engine.repository.PathSegmentRepository;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import com.pathtopology.engine.service.boundary.AdministrativeLayerBinding;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.LineString;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Segment operations exposed over the API: WKT decoding in front of the
 * write pipeline, plus read models of a segment and its events.
 */
@Service
@RequiredArgsConstructor
public class PathSegmentService {

    private final SegmentWritePipeline writePipeline;
    private final WktGeometryReader wktReader;
    private final PathSegmentRepository segmentRepository;
    private final TopologyEventRepository eventRepository;
    private final SegmentEventLinkRepository linkRepository;
    private final List<AdministrativeLayerBinding> layerBindings;

    public SegmentRecord create(SegmentRequest request) {
        LineString cadastral = request.cadastralWkt() == null || request.cadastralWkt().isBlank()
            ? null
            : wktReader.readLineString(request.cadastralWkt());
        PathSegment segment = writePipeline.onSegmentInserted(wktReader.read(request.wkt()), cadastral);
        return SegmentRecord.fromEntity(segment);
    }

    public SegmentRecord updateGeometry(Long segmentId, GeometryUpdateRequest request) {
        PathSegment segment = writePipeline.onSegmentGeometryUpdated(segmentId, wktReader.read(request.wkt()));
        return SegmentRecord.fromEntity(segment);
    }

    public CascadeOutcome delete(Long segmentId) {
        return writePipeline.onSegmentDeleted(segmentId);
    }

    @Transactional(readOnly = true)
    public SegmentRecord getSegment(Long segmentId) {
        return SegmentRecord.fromEntity(findSegment(segmentId));
    }

    @Transactional(readOnly = true)
    public List<EventRecord> getEvents(Long segmentId) {
        findSegment(segmentId);
        List<TopologyEvent> events = eventRepository.findLinkedToSegment(segmentId);
        if (events.isEmpty()) {
            return List.of();
        }

        Map<Long, List<SegmentEventLink>> linksByEvent = linkRepository
            .findByEventIdIn(events.stream().map(TopologyEvent::getId).toList()).stream()
            .collect(Collectors.groupingBy(SegmentEventLink::getEventId));

        return events.stream()
            .map(event -> EventRecord.fromEntity(event, linksByEvent.getOrDefault(event.getId(), List.of())))
            .toList();
    }

    /**
     * Administrative polygons the segment runs through, by layer.
     */
    @Transactional(readOnly = true)
    public Map<AdministrativeLayer, List<BoundaryCrossingRecord>> getBoundaries(Long segmentId) {
        findSegment(segmentId);
        Map<Long, SegmentEventLink> linkByEvent = linkRepository.findBySegmentId(segmentId).stream()
            .collect(Collectors.toMap(SegmentEventLink::getEventId, link -> link, (first, second) -> first));

        Map<AdministrativeLayer, List<Long>> eventIdsByLayer = new EnumMap<>(AdministrativeLayer.class);
        for (TopologyEvent event : eventRepository.findLinkedToSegment(segmentId)) {
            if (event.isActive() && event.getOrigin().isBoundary()) {
                eventIdsByLayer
                    .computeIfAbsent(AdministrativeLayer.fromOrigin(event.getOrigin()), layer -> new ArrayList<>())
                    .add(event.getId());
            }
        }

        Map<AdministrativeLayer, List<BoundaryCrossingRecord>> crossings = new EnumMap<>(AdministrativeLayer.class);
        for (AdministrativeLayerBinding binding : layerBindings) {
            List<Long> eventIds = eventIdsByLayer.getOrDefault(binding.layer(), List.of());
            if (eventIds.isEmpty()) {
                continue;
            }
            Map<Long, String> areaIds = binding.findAreaIds(eventIds);
            List<BoundaryCrossingRecord> records = eventIds.stream()
                .filter(areaIds::containsKey)
                .map(eventId -> {
                    SegmentEventLink link = linkByEvent.get(eventId);
                    return new BoundaryCrossingRecord(eventId, binding.layer(), areaIds.get(eventId),
                        link.getStartPosition(), link.getEndPosition());
                })
                .toList();
            crossings.put(binding.layer(), records);
        }
        return crossings;
    }

    private PathSegment findSegment(Long segmentId) {
        return segmentRepository.findById(segmentId)
            .orElseThrow(() -> new SegmentNotFoundException(segmentId));
    }
}
