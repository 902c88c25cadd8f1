package com.pathtopology.engine.dto;

/**
 * Counts of events touched by a resynchronization.
 */
public record ResynchronizationResult(int rebuiltEvents, int relocatedEvents) {

    public static final ResynchronizationResult NONE = new ResynchronizationResult(0, 0);
}
