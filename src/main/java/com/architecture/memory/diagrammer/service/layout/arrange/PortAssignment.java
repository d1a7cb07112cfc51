package com.architecture.memory.diagrammer.service.layout.arrange;

/**
 * Exit port on the source shape and entry port on the target shape of one connector.
 */
public record PortAssignment(PortPosition exit, PortPosition entry) {
}
