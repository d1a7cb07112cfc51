package com.architecture.memory.diagrammer.service.layout.arrange;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Placement settings for the simple row/column/grid/tree arrangements.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArrangementConfig {

    @Builder.Default
    private double startX = 50;

    @Builder.Default
    private double startY = 50;

    @Builder.Default
    private double horizontalSpacing = 60;

    @Builder.Default
    private double verticalSpacing = 60;

    @Builder.Default
    private double defaultWidth = 120;

    @Builder.Default
    private double defaultHeight = 60;

    @Builder.Default
    private int gridSize = 10;
}
