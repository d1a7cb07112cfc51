package com.architecture.memory.diagrammer.exception;

public class DiagramNotFoundException extends RuntimeException {

    public DiagramNotFoundException(String message) {
        super(message);
    }
}
