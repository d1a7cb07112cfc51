package com.architecture.memory.diagrammer.service.layout.polish;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What each stage of a polish run changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolishReport {
    private int relaidOut;
    private int overlapsFixed;
    private int compacted;
    private int rowsAligned;
    private int columnsAligned;
    private int sizesEqualized;
    private int centered;
    private int marginShifted;
    private int edgesRouted;
    private int edgesOptimized;
}
