package com.architecture.memory.diagrammer.service.layout.overlap;

/**
 * Two shapes whose margin-padded boxes intersect, in document order.
 */
public record OverlapPair(String firstId, String secondId) {
}
