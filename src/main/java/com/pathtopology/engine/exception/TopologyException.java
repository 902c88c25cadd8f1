package com.pathtopology.engine.exception;

/**
 * Base type for every failure raised by the topology pipeline.
 *
 * Unchecked so that any failure inside a segment write rolls back the
 * enclosing transaction together with all partially derived rows.
 */
public abstract class TopologyException extends RuntimeException {

    protected TopologyException(String message) {
        super(message);
    }

    protected TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
