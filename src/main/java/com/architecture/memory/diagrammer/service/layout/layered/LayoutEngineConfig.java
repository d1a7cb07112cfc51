package com.architecture.memory.diagrammer.service.layout.layered;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tuning knobs for the layered layout engine. The application-wide default is a Spring
 * bean; callers derive per-request variants with {@code toBuilder()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LayoutEngineConfig {

    @Builder.Default
    private double rankSpacing = 100;

    @Builder.Default
    private double nodeSpacing = 60;

    @Builder.Default
    private double defaultWidth = 120;

    @Builder.Default
    private double defaultHeight = 60;

    @Builder.Default
    private int gridSize = 10;

    @Builder.Default
    private int maxOverlapIterations = 50;

    @Builder.Default
    private double overlapPadding = 20;

    @Builder.Default
    private int barycenterIterations = 4;

    // Router clearance around shapes
    @Builder.Default
    private double edgeMargin = 15;

    @Builder.Default
    private boolean routeEdges = true;

    @Builder.Default
    private int maxRouteExpansions = 20000;

    @Builder.Default
    private double startX = 50;

    @Builder.Default
    private double startY = 80;
}
