package com.pathtopology.engine.dto;

import java.util.List;

/**
 * Derived writes applied before a segment is deleted.
 *
 * @param orphanedEventIds  events that lost their last link
 * @param unpublishedRoutes number of published routes whose flag was cleared
 */
public record CascadeOutcome(List<Long> orphanedEventIds, int unpublishedRoutes) {

    public static final CascadeOutcome NONE = new CascadeOutcome(List.of(), 0);
}
