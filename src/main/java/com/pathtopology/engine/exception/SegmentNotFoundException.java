package com.pathtopology.engine.exception;

import lombok.Getter;

@Getter
public class SegmentNotFoundException extends TopologyException {

    private final Long segmentId;

    public SegmentNotFoundException(Long segmentId) {
        super("Path segment not found: " + segmentId);
        this.segmentId = segmentId;
    }
}
