package com.pathtopology.engine.dto;

import com.pathtopology.engine.entity.EventOrigin;
import com.pathtopology.engine.entity.EventState;
import com.pathtopology.engine.entity.SegmentEventLink;
import com.pathtopology.engine.entity.TopologyEvent;
import org.locationtech.jts.io.WKTWriter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * API view of a topology event with its links.
 */
public record EventRecord(
    Long id,
    String kind,
    EventOrigin origin,
    EventState state,
    Double lateralOffset,
    Double length,
    String wkt,
    List<LinkRecord> links,
    LocalDateTime createdAt,
    LocalDateTime orphanedAt
) {

    public static EventRecord fromEntity(TopologyEvent event, List<SegmentEventLink> links) {
        return new EventRecord(
            event.getId(),
            event.getKind(),
            event.getOrigin(),
            event.getState(),
            event.getLateralOffset(),
            event.getLength(),
            event.getGeometry() == null ? null : new WKTWriter(3).write(event.getGeometry()),
            links.stream().map(LinkRecord::fromEntity).toList(),
            event.getCreatedAt(),
            event.getOrphanedAt()
        );
    }
}
