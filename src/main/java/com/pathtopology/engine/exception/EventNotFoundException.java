package com.pathtopology.engine.exception;

import lombok.Getter;

@Getter
public class EventNotFoundException extends TopologyException {

    private final Long eventId;

    public EventNotFoundException(Long eventId) {
        super("Topology event not found: " + eventId);
        this.eventId = eventId;
    }
}
