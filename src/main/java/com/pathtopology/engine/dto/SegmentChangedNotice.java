package com.pathtopology.engine.dto;

import java.time.Instant;
import java.util.List;

/**
 * Broadcast to observers once a segment write has committed.
 *
 * Boundary events are regenerated on every geometry change, so observers
 * must re-read them from {@code boundaryEventIds} rather than keep old ids.
 *
 * @param segmentId        the segment written
 * @param change           kind of write
 * @param boundaryEventIds boundary events created by the write
 * @param orphanedEventIds events orphaned by a deletion
 * @param timestamp        when the write completed
 */
public record SegmentChangedNotice(
    Long segmentId,
    Change change,
    List<Long> boundaryEventIds,
    List<Long> orphanedEventIds,
    Instant timestamp
) {

    public enum Change {
        INSERTED,
        UPDATED,
        DELETED
    }

    public static SegmentChangedNotice inserted(Long segmentId, List<Long> boundaryEventIds) {
        return new SegmentChangedNotice(segmentId, Change.INSERTED, List.copyOf(boundaryEventIds), List.of(), Instant.now());
    }

    public static SegmentChangedNotice updated(Long segmentId, List<Long> boundaryEventIds) {
        return new SegmentChangedNotice(segmentId, Change.UPDATED, List.copyOf(boundaryEventIds), List.of(), Instant.now());
    }

    public static SegmentChangedNotice deleted(Long segmentId, List<Long> orphanedEventIds) {
        return new SegmentChangedNotice(segmentId, Change.DELETED, List.of(), List.copyOf(orphanedEventIds), Instant.now());
    }

    public String toLogString() {
        return String.format("SegmentChanged[id=%d, change=%s, boundaryEvents=%d, orphaned=%d]",
            segmentId, change, boundaryEventIds.size(), orphanedEventIds.size());
    }
}
