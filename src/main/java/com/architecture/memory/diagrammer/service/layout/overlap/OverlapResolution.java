package com.architecture.memory.diagrammer.service.layout.overlap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one overlap-resolution run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlapResolution {

    // Push passes run, including the final clean pass
    private int iterations;

    // False when the iteration cap was reached with padded overlap left
    private boolean converged;

    private int movedCount;
}
