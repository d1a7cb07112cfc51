package com.architecture.memory.diagrammer.service.layout.arrange;

/**
 * A source/target pair of shape ids.
 */
public record Connection(String sourceId, String targetId) {
}
