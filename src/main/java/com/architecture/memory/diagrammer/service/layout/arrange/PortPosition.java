package com.architecture.memory.diagrammer.service.layout.arrange;

/**
 * Connection point as fractions of the shape's width and height (0.5, 0 is top-center).
 */
public record PortPosition(double x, double y) {
}
