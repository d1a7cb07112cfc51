package com.architecture.memory.diagrammer.service.layout.geometry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentGeometryTest {

    private final Bounds box = new Bounds(100, 100, 50, 50);

    @Test
    void segmentThroughBoxIsDetected() {
        assertThat(SegmentGeometry.lineIntersectsBox(0, 125, 300, 125, box)).isTrue();
        assertThat(SegmentGeometry.lineIntersectsBox(0, 0, 300, 50, box)).isFalse();
    }

    @Test
    void diagonalSegmentCrossingCornerIsDetected() {
        assertThat(SegmentGeometry.lineIntersectsBox(90, 90, 160, 160, box)).isTrue();
    }

    @Test
    void runningAlongBorderDoesNotCrossInterior() {
        assertThat(SegmentGeometry.orthogonalSegmentCrossesInterior(0, 100, 300, 100, box)).isFalse();
        assertThat(SegmentGeometry.orthogonalSegmentCrossesInterior(0, 120, 300, 120, box)).isTrue();
        assertThat(SegmentGeometry.orthogonalSegmentCrossesInterior(120, 0, 120, 99, box)).isFalse();
    }

    @Test
    void marginExpandsObstacles() {
        List<Bounds> obstacles = List.of(box);

        assertThat(SegmentGeometry.anyObstacleOnSegment(0, 95, 300, 95, obstacles, 0)).isFalse();
        assertThat(SegmentGeometry.anyObstacleOnSegment(0, 95, 300, 95, obstacles, 10)).isTrue();
    }
}
