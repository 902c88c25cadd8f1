package com.pathtopology.engine.exception;

/**
 * The elevation lookup failed or returned an unusable answer. Segment
 * writes never fall back to degraded indicators, they abort.
 */
public class ElevationUnavailableException extends TopologyException {

    public ElevationUnavailableException(String message) {
        super(message);
    }

    public ElevationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
