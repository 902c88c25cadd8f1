package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.EventRecord;
import com.pathtopology.engine.dto.EventRequest;
import com.pathtopology.engine.dto.LinkRequest;
import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.EventOrigin;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.exception.EventNotFoundException;
import com.pathtopology.engine.exception.InvalidEventException;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.repository.PathSegmentRepository;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual events: created by API callers, located only by their links.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopologyEventService {

    private final TopologyEventRepository eventRepository;
    private final SegmentEventLinkRepository linkRepository;
    private final PathSegmentRepository segmentRepository;
    private final EventGeometryBuilder geometryBuilder;

    @Transactional
    public EventRecord createEvent(EventRequest request) {
        if (AdministrativeLayer.isSystemKind(request.kind())) {
            throw new InvalidEventException("Event kind " + request.kind() + " is reserved for boundary events");
        }
        boolean point = request.links().stream().allMatch(link -> link.start().equals(link.end()));
        if (point && request.links().size() > 1) {
            throw new InvalidEventException("A point event is located by exactly one link");
        }

        Map<Long, PathSegment> segments = new HashMap<>();
        for (LinkRequest link : request.links()) {
            segments.computeIfAbsent(link.segmentId(), id -> segmentRepository.findById(id)
                .orElseThrow(() -> new SegmentNotFoundException(id)));
        }

        TopologyEvent event = eventRepository.save(TopologyEvent.builder()
            .kind(request.kind())
            .origin(EventOrigin.MANUAL)
            .lateralOffset(request.offsetOrZero())
            .build());

        List<SegmentEventLink> links = new ArrayList<>();
        for (int i = 0; i < request.links().size(); i++) {
            LinkRequest link = request.links().get(i);
            links.add(SegmentEventLink.of(link.segmentId(), event.getId(), link.start(), link.end(), i));
        }
        List<SegmentEventLink> savedLinks = linkRepository.saveAll(links);

        Geometry geometry = geometryBuilder.build(savedLinks, segments, event.getLateralOffset());
        event.setGeometry(geometry);
        event.setLength(geometry.getLength());
        TopologyEvent saved = eventRepository.save(event);

        log.info("Created {} event {} on {} segments", saved.getKind(), saved.getId(), segments.size());
        return EventRecord.fromEntity(saved, savedLinks);
    }

    @Transactional(readOnly = true)
    public EventRecord getEvent(Long eventId) {
        TopologyEvent event = eventRepository.findById(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));
        return EventRecord.fromEntity(event, linkRepository.findByEventIdOrderByOrderIndexAsc(eventId));
    }
}
