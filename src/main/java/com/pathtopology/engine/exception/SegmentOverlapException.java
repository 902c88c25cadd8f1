package com.pathtopology.engine.exception;

import lombok.Getter;

/**
 * Raised when a candidate geometry shares a sub-line with an existing segment.
 */
@Getter
public class SegmentOverlapException extends TopologyException {

    private final Long segmentId;
    private final Long conflictingSegmentId;

    public SegmentOverlapException(Long segmentId, Long conflictingSegmentId) {
        super(String.format("Segment %s overlaps existing segment %d",
            segmentId == null ? "(new)" : segmentId, conflictingSegmentId));
        this.segmentId = segmentId;
        this.conflictingSegmentId = conflictingSegmentId;
    }
}
