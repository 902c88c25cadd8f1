package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.CascadeOutcome;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.repository.PublishedRouteRepository;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps events and published routes consistent when a segment goes away.
 *
 * Runs inside the deleting transaction, before the segment row is removed:
 * - events left without any link are orphaned, others are left alone
 * - every published route built on a linked event is unpublished, whether
 *   or not its event survives, since its routing is now broken
 * - the segment's links are removed
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadeDeletionHandler {

    private final SegmentEventLinkRepository linkRepository;
    private final TopologyEventRepository eventRepository;
    private final PublishedRouteRepository publishedRouteRepository;

    public CascadeOutcome beforeSegmentDeleted(Long segmentId) {
        Set<Long> eventIds = linkRepository.findBySegmentId(segmentId).stream()
            .map(SegmentEventLink::getEventId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (eventIds.isEmpty()) {
            return CascadeOutcome.NONE;
        }

        LocalDateTime now = LocalDateTime.now();
        int unpublished = publishedRouteRepository.unpublishByEventIds(eventIds, now);

        List<Long> orphanIds = eventIds.stream()
            .filter(eventId -> !linkRepository.existsByEventIdAndSegmentIdNot(eventId, segmentId))
            .toList();
        if (!orphanIds.isEmpty()) {
            List<TopologyEvent> orphans = eventRepository.findAllById(orphanIds);
            orphans.forEach(event -> event.orphan(now));
            eventRepository.saveAll(orphans);
        }

        linkRepository.deleteBySegmentId(segmentId);

        log.info("Segment {} deletion: {} linked events, {} orphaned, {} routes unpublished",
            segmentId, eventIds.size(), orphanIds.size(), unpublished);
        return new CascadeOutcome(orphanIds, unpublished);
    }
}
