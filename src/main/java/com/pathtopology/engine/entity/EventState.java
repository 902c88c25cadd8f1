package com.pathtopology.engine.entity;

/**
 * Lifecycle of a topology event. An event becomes ORPHANED when the last
 * segment it was linked to is deleted, and never returns to ACTIVE.
 */
public enum EventState {
    ACTIVE,
    ORPHANED
}
