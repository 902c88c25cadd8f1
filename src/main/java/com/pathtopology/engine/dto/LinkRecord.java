package com.pathtopology.engine.dto;

import com.pathtopology.engine.entity.SegmentEventLink;

public record LinkRecord(Long segmentId, Double startPosition, Double endPosition, Integer orderIndex) {

    public static LinkRecord fromEntity(SegmentEventLink link) {
        return new LinkRecord(link.getSegmentId(), link.getStartPosition(), link.getEndPosition(), link.getOrderIndex());
    }
}
