package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.ResynchronizationResult;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.geometry.GeometryEngine;
import com.pathtopology.engine.geometry.LinearPosition;
import com.pathtopology.engine.repository.PathSegmentRepository;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Brings the events linked to a segment back in line with its geometry.
 *
 * Two policies:
 * - position-sticky: linear events, and point events lying on the path,
 *   keep their linear positions and get their geometry rebuilt on the new
 *   line. They move with the path.
 * - location-sticky: point events with a lateral offset (a bench beside the
 *   path) keep their stored point. Their position and offset are recomputed
 *   by projecting that point on the new line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeometryResynchronizer {

    private final TopologyEventRepository eventRepository;
    private final SegmentEventLinkRepository linkRepository;
    private final PathSegmentRepository segmentRepository;
    private final EventGeometryBuilder geometryBuilder;
    private final GeometryEngine geometryEngine;

    public ResynchronizationResult resynchronize(PathSegment segment) {
        Map<Long, List<SegmentEventLink>> linksByEvent = linkRepository.findBySegmentId(segment.getId()).stream()
            .collect(Collectors.groupingBy(SegmentEventLink::getEventId, LinkedHashMap::new, Collectors.toList()));
        if (linksByEvent.isEmpty()) {
            return ResynchronizationResult.NONE;
        }

        int rebuilt = 0;
        int relocated = 0;
        for (TopologyEvent event : eventRepository.findAllById(linksByEvent.keySet())) {
            if (!event.isActive()) {
                continue;
            }
            List<SegmentEventLink> onSegment = linksByEvent.get(event.getId());
            if (isLocationSticky(event, onSegment)) {
                relocate(event, onSegment, segment);
                relocated++;
            } else {
                rebuild(event, segment);
                rebuilt++;
            }
        }

        log.info("Segment {}: {} events rebuilt, {} offset events relocated", segment.getId(), rebuilt, relocated);
        return new ResynchronizationResult(rebuilt, relocated);
    }

    static boolean isLocationSticky(TopologyEvent event, List<SegmentEventLink> linksOnSegment) {
        return event.hasLateralOffset()
            && event.getGeometry() instanceof Point
            && linksOnSegment.stream().allMatch(SegmentEventLink::isPoint);
    }

    private void relocate(TopologyEvent event, List<SegmentEventLink> linksOnSegment, PathSegment segment) {
        LinearPosition projected = geometryEngine.interpolateAlong(segment.getGeometry(), (Point) event.getGeometry());

        linksOnSegment.forEach(link -> link.moveTo(projected.position()));
        linkRepository.saveAll(linksOnSegment);

        event.setLateralOffset(projected.lateralDistance());
        eventRepository.save(event);

        log.debug("Event {} kept in place: position={} offset={}",
            event.getId(), projected.position(), projected.lateralDistance());
    }

    private void rebuild(TopologyEvent event, PathSegment segment) {
        List<SegmentEventLink> links = linkRepository.findByEventIdOrderByOrderIndexAsc(event.getId());

        Geometry geometry = geometryBuilder.build(links, segmentsOf(links, segment), event.getLateralOffset());
        event.setGeometry(geometry);
        event.setLength(geometry.getLength());
        eventRepository.save(event);
    }

    private Map<Long, PathSegment> segmentsOf(List<SegmentEventLink> links, PathSegment changed) {
        Set<Long> otherIds = links.stream()
            .map(SegmentEventLink::getSegmentId)
            .filter(id -> !id.equals(changed.getId()))
            .collect(Collectors.toSet());

        Map<Long, PathSegment> segments = otherIds.isEmpty()
            ? new LinkedHashMap<>()
            : segmentRepository.findAllById(otherIds).stream()
                .collect(Collectors.toMap(PathSegment::getId, Function.identity()));
        segments.put(changed.getId(), changed);
        return segments;
    }
}
