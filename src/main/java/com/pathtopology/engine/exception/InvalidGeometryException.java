package com.pathtopology.engine.exception;

public class InvalidGeometryException extends TopologyException {

    public InvalidGeometryException(String message) {
        super(message);
    }

    public InvalidGeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
