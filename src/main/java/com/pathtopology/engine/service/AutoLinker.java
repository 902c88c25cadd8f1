package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.EventOrigin;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import com.pathtopology.engine.geometry.GeometryEngine;
import com.pathtopology.engine.repository.SegmentEventLinkRepository;
import com.pathtopology.engine.repository.TopologyEventRepository;
import com.pathtopology.engine.service.boundary.AdministrativeArea;
import com.pathtopology.engine.service.boundary.AdministrativeLayerBinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives boundary events of a segment against every administrative layer.
 *
 * For each polygon crossed by the segment, every linear stretch of the
 * intersection becomes one event of the layer's kind, linked to the segment
 * by the positions of the stretch endpoints along the whole segment line,
 * and linked to the polygon in the layer's admin-link table.
 *
 * Boundary events are never patched: on a geometry update they are
 * discarded and created again with fresh ids.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoLinker {

    private final List<AdministrativeLayerBinding> layerBindings;
    private final TopologyEventRepository eventRepository;
    private final SegmentEventLinkRepository linkRepository;
    private final GeometryEngine geometryEngine;

    /**
     * Boundary events for a freshly inserted segment.
     *
     * @return ids of the created events
     */
    public List<Long> linkNewSegment(PathSegment segment) {
        List<Long> created = new ArrayList<>();
        for (AdministrativeLayerBinding binding : layerBindings) {
            created.addAll(linkLayer(segment, binding));
        }
        log.info("Segment {}: {} boundary events created", segment.getId(), created.size());
        return created;
    }

    /**
     * Replaces every boundary event of a segment whose geometry changed.
     *
     * @return ids of the created events
     */
    public List<Long> relinkSegment(PathSegment segment) {
        int discarded = discardBoundaryEvents(segment.getId());
        List<Long> created = new ArrayList<>();
        for (AdministrativeLayerBinding binding : layerBindings) {
            created.addAll(linkLayer(segment, binding));
        }
        log.info("Segment {}: {} boundary events discarded, {} created",
            segment.getId(), discarded, created.size());
        return created;
    }

    /**
     * Removes the boundary events linked to the segment along with their
     * links and admin-link rows.
     *
     * @return number of events removed
     */
    public int discardBoundaryEvents(Long segmentId) {
        List<Long> eventIds = eventRepository.findIdsLinkedToSegmentWithOrigin(
            segmentId, EventOrigin.boundaryOrigins());
        if (eventIds.isEmpty()) {
            return 0;
        }

        linkRepository.deleteByEventIds(eventIds);
        for (AdministrativeLayerBinding binding : layerBindings) {
            binding.unlink(eventIds);
        }
        eventRepository.deleteAllByIdInBatch(eventIds);
        return eventIds.size();
    }

    private List<Long> linkLayer(PathSegment segment, AdministrativeLayerBinding binding) {
        LineString line = segment.getGeometry();
        List<Long> created = new ArrayList<>();

        for (AdministrativeArea area : binding.findIntersecting(line)) {
            Geometry shared = geometryEngine.intersection(area.geometry(), line);

            for (Geometry fragment : geometryEngine.decompose(shared)) {
                if (!(fragment instanceof LineString stretch)) {
                    // a polygon touching the segment at a single point has no extent to record
                    continue;
                }
                double[] range = geometryEngine.locateStretchAlongLine(line, stretch);
                double a = range[0];
                double b = range[1];

                TopologyEvent event = eventRepository.save(TopologyEvent.boundary(binding.layer(), line));
                linkRepository.save(SegmentEventLink.of(segment.getId(), event.getId(), a, b));
                binding.link(event.getId(), area.id());
                created.add(event.getId());

                log.debug("Segment {} crosses {} {} between {} and {}: event {}",
                    segment.getId(), binding.layer(), area.id(), Math.min(a, b), Math.max(a, b), event.getId());
            }
        }
        return created;
    }
}
