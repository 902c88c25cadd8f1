package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.EventOrigin;
import com.pathtopology.engine.entity.TopologyEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TopologyEventRepository extends JpaRepository<TopologyEvent, Long> {

    /**
     * Every event holding at least one link on the segment.
     */
    @Query("""
        SELECT DISTINCT e FROM TopologyEvent e, SegmentEventLink l
        WHERE l.eventId = e.id
        AND l.segmentId = :segmentId
        ORDER BY e.id
        """)
    List<TopologyEvent> findLinkedToSegment(@Param("segmentId") Long segmentId);

    /**
     * Ids of the events of the given origins linked to the segment. Used to
     * find the boundary events to discard before they are regenerated.
     */
    @Query("""
        SELECT DISTINCT e.id FROM TopologyEvent e, SegmentEventLink l
        WHERE l.eventId = e.id
        AND l.segmentId = :segmentId
        AND e.origin IN :origins
        """)
    List<Long> findIdsLinkedToSegmentWithOrigin(
        @Param("segmentId") Long segmentId,
        @Param("origins") Collection<EventOrigin> origins
    );
}
