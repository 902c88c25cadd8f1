package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.SegmentEventLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SegmentEventLinkRepository extends JpaRepository<SegmentEventLink, Long> {

    List<SegmentEventLink> findBySegmentId(Long segmentId);

    List<SegmentEventLink> findByEventIdOrderByOrderIndexAsc(Long eventId);

    List<SegmentEventLink> findByEventIdIn(Collection<Long> eventIds);

    /**
     * Whether the event keeps a link once the given segment is gone.
     */
    boolean existsByEventIdAndSegmentIdNot(Long eventId, Long segmentId);

    @Modifying
    @Query("DELETE FROM SegmentEventLink l WHERE l.segmentId = :segmentId")
    int deleteBySegmentId(@Param("segmentId") Long segmentId);

    @Modifying
    @Query("DELETE FROM SegmentEventLink l WHERE l.eventId IN :eventIds")
    int deleteByEventIds(@Param("eventIds") Collection<Long> eventIds);
}
