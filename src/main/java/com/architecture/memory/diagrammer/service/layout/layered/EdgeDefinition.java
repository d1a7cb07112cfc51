package com.architecture.memory.diagrammer.service.layout.layered;

/**
 * A directed edge between two node labels, as handed to the layered layout.
 */
public record EdgeDefinition(String source, String target, String label) {

    public EdgeDefinition(String source, String target) {
        this(source, target, "");
    }
}
