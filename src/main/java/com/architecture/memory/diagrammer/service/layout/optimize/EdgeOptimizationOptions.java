package com.architecture.memory.diagrammer.service.layout.optimize;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Thresholds for {@link EdgePathOptimizer}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeOptimizationOptions {

    // Clearance kept around shapes
    @Builder.Default
    private double margin = 15;

    // Largest off-axis deviation that still counts as a horizontal/vertical segment
    @Builder.Default
    private double straightenThreshold = 8;

    // Gap between parallel connectors sharing a corridor
    @Builder.Default
    private double nudgeSpacing = 10;

    public static EdgeOptimizationOptions defaults() {
        return EdgeOptimizationOptions.builder().build();
    }
}
