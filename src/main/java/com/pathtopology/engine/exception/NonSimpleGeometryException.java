package com.pathtopology.engine.exception;

public class NonSimpleGeometryException extends TopologyException {

    public NonSimpleGeometryException(String message) {
        super(message);
    }
}
