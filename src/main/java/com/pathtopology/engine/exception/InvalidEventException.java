package com.pathtopology.engine.exception;

public class InvalidEventException extends TopologyException {

    public InvalidEventException(String message) {
        super(message);
    }
}
